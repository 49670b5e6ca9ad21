package types;

// contiguous block of marker indices [start, end)
public final class MarkerRange {

	private final int start;
	private final int end;

	public MarkerRange(int start, int end) {
		if (start < 0 || end < start) {
			throw new InvalidRangeException("Invalid marker range [" + start + ", " + end + ")");
		}
		this.start = start;
		this.end = end;
	}

	// the block of markers belonging to one animal
	public static MarkerRange forAnimal(int animal, int markersPerAnimal) {
		return new MarkerRange(animal * markersPerAnimal, (animal + 1) * markersPerAnimal);
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public int length() {
		return end - start;
	}

	public boolean overlaps(MarkerRange other) {
		return this.start < other.end && other.start < this.end;
	}

	public String toString() {
		return "[" + start + ", " + end + ")";
	}

}
