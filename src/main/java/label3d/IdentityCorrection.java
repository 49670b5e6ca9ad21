package label3d;

import java.util.logging.Logger;

import types.InvalidRangeException;
import types.MarkerRange;
import types.Observation;
import types.UnsupportedAnimalCountException;

/**
 * Exchanges two animals' marker blocks in a single camera view and frame.
 */
public class IdentityCorrection {

	private static final Logger LOGGER = Logger.getLogger(IdentityCorrection.class.getName());

	private final CorrespondenceStore store;
	private final int nAnimals;

	public IdentityCorrection(CorrespondenceStore store, int nAnimals) {
		this.store = store;
		this.nAnimals = nAnimals;
	}

	// swaps the first and second animal
	public void swapAnimals(int camera, int frame) {
		this.checkAnimalCount();
		int markersPerAnimal = this.store.getNumMarkers() / this.nAnimals;
		this.swapAnimals(camera, frame, MarkerRange.forAnimal(0, markersPerAnimal),
				MarkerRange.forAnimal(1, markersPerAnimal));
	}

	/**
	 * Exchanges position, status and hand-labeled flag of a.start+i and b.start+i for every
	 * offset i, in the given camera and frame only. 3D points and other cameras are untouched.
	 * All validation happens before the first write.
	 */
	public void swapAnimals(int camera, int frame, MarkerRange a, MarkerRange b) {
		this.checkAnimalCount();
		if (a.length() != b.length()) {
			throw new InvalidRangeException("Ranges " + a + " and " + b + " differ in length");
		}
		if (a.overlaps(b)) {
			throw new InvalidRangeException("Ranges " + a + " and " + b + " overlap");
		}
		int nMarkers = this.store.getNumMarkers();
		if (a.getEnd() > nMarkers || b.getEnd() > nMarkers) {
			throw new InvalidRangeException("Ranges " + a + " and " + b + " exceed [0, " + nMarkers + ")");
		}
		if (camera < 0 || camera >= this.store.getNumCams()) {
			throw new IndexOutOfBoundsException("Camera " + camera + " outside [0, " + this.store.getNumCams() + ")");
		}
		if (frame < 0 || frame >= this.store.getNumFrames()) {
			throw new IndexOutOfBoundsException("Frame " + frame + " outside [0, " + this.store.getNumFrames() + ")");
		}

		Observation[] blockA = new Observation[a.length()];
		Observation[] blockB = new Observation[b.length()];
		for (int i = 0; i < a.length(); i++) {
			blockA[i] = this.store.getObservation(a.getStart() + i, camera, frame);
			blockB[i] = this.store.getObservation(b.getStart() + i, camera, frame);
		}
		for (int i = 0; i < a.length(); i++) {
			this.store.setObservation(a.getStart() + i, camera, frame, blockB[i]);
			this.store.setObservation(b.getStart() + i, camera, frame, blockA[i]);
		}

		LOGGER.fine("Swapped markers " + a + " and " + b + " in camera " + camera + " frame " + frame);
	}

	private void checkAnimalCount() {
		if (this.nAnimals != 2) {
			throw new UnsupportedAnimalCountException(this.nAnimals);
		}
	}

}
