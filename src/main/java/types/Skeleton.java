package types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// marker names and segment topology. display metadata only; nothing here feeds triangulation.
public class Skeleton {

	private List<String> jointNames = new ArrayList<String>();
	private List<int[]> segments = new ArrayList<int[]>();
	private List<double[]> segmentColors = new ArrayList<double[]>();
	private List<double[]> markerColors = new ArrayList<double[]>();

	public Skeleton(List<String> jointNames) {
		this.jointNames.addAll(jointNames);
	}

	public void addSegment(int from, int to, double r, double g, double b) {
		if (from < 0 || from >= jointNames.size() || to < 0 || to >= jointNames.size()) {
			throw new IndexOutOfBoundsException("Segment " + from + " -> " + to + " outside [0, " + jointNames.size() + ")");
		}
		this.segments.add(new int[] { from, to });
		this.segmentColors.add(new double[] { r, g, b });
	}

	public void setMarkerColor(int marker, double r, double g, double b) {
		while (this.markerColors.size() < this.jointNames.size()) {
			this.markerColors.add(new double[] { 1, 1, 1 });
		}
		this.markerColors.set(marker, new double[] { r, g, b });
	}

	public int getNumMarkers() {
		return jointNames.size();
	}

	public List<String> getJointNames() {
		return Collections.unmodifiableList(jointNames);
	}

	public List<int[]> getSegments() {
		return Collections.unmodifiableList(segments);
	}

	public List<double[]> getSegmentColors() {
		return Collections.unmodifiableList(segmentColors);
	}

	public List<double[]> getMarkerColors() {
		return Collections.unmodifiableList(markerColors);
	}

}
