package label3d;

import types.MarkerStatus;

// per marker/frame overview of labeling progress across all views
public class StatusSummary {

	private final int nMarkers;
	private final int nFrames;
	private final MarkerStatus[][] modal;
	private final int[] counts = new int[MarkerStatus.values().length];
	private int labeledFrames = 0;

	public StatusSummary(CorrespondenceStore store) {
		this.nMarkers = store.getNumMarkers();
		this.nFrames = store.getNumFrames();
		this.modal = new MarkerStatus[nMarkers][nFrames];

		for (int frame = 0; frame < nFrames; frame++) {
			boolean anyLabeled = false;
			for (int marker = 0; marker < nMarkers; marker++) {
				int[] perMarker = new int[MarkerStatus.values().length];
				for (int cam = 0; cam < store.getNumCams(); cam++) {
					MarkerStatus status = store.getStatus(marker, cam, frame);
					perMarker[status.ordinal()]++;
					this.counts[status.ordinal()]++;
					anyLabeled |= status == MarkerStatus.LABELED;
				}
				// ties resolve to the higher status code
				int best = 0;
				for (int s = 1; s < perMarker.length; s++) {
					if (perMarker[s] >= perMarker[best]) {
						best = s;
					}
				}
				this.modal[marker][frame] = MarkerStatus.values()[best];
			}
			if (anyLabeled) {
				this.labeledFrames++;
			}
		}
	}

	public MarkerStatus getModalStatus(int marker, int frame) {
		return modal[marker][frame];
	}

	public int getCount(MarkerStatus status) {
		return counts[status.ordinal()];
	}

	// frames with at least one LABELED observation
	public int getLabeledFrames() {
		return labeledFrames;
	}

	public int getNumMarkers() {
		return nMarkers;
	}

	public int getNumFrames() {
		return nFrames;
	}

}
