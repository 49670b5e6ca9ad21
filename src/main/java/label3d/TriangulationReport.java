package label3d;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// outcome of triangulating a set of markers and frames
public class TriangulationReport {

	public enum Outcome {
		TRIANGULATED, INSUFFICIENT_VIEWS, DEGENERATE
	}

	private int triangulated = 0;
	private int insufficientViews = 0;
	private List<int[]> degenerate = new ArrayList<int[]>();

	public void record(int marker, int frame, Outcome outcome) {
		switch (outcome) {
		case TRIANGULATED:
			this.triangulated++;
			break;
		case INSUFFICIENT_VIEWS:
			this.insufficientViews++;
			break;
		case DEGENERATE:
			this.degenerate.add(new int[] { marker, frame });
			break;
		}
	}

	public void merge(TriangulationReport other) {
		this.triangulated += other.triangulated;
		this.insufficientViews += other.insufficientViews;
		this.degenerate.addAll(other.degenerate);
	}

	public int getTriangulated() {
		return triangulated;
	}

	public int getInsufficientViews() {
		return insufficientViews;
	}

	// (marker, frame) pairs whose solve was rejected and kept their previous 3D point
	public List<int[]> getDegenerate() {
		return Collections.unmodifiableList(degenerate);
	}

	public String toString() {
		return "TriangulationReport { triangulated: " + triangulated + ", insufficientViews: " + insufficientViews
				+ ", degenerate: " + degenerate.size() + " }";
	}

}
