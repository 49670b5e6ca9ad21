package label3d;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import types.InvalidRangeException;
import types.MarkerRange;
import types.MarkerStatus;
import types.Observation;
import types.Point2D;
import types.UnsupportedAnimalCountException;

public class IdentityCorrectionTest {

	private static final int MARKERS = 34;
	private static final int CAMS = 3;
	private static final int FRAMES = 6;

	private CorrespondenceStore store;
	private IdentityCorrection correction;

	@BeforeEach
	public void setUp() {
		this.store = new CorrespondenceStore(MARKERS, CAMS, FRAMES);
		for (int m = 0; m < MARKERS; m++) {
			for (int c = 0; c < CAMS; c++) {
				for (int f = 0; f < FRAMES; f++) {
					switch ((m + c + f) % 4) {
					case 0:
						this.store.placeObservation(m, c, f, new Point2D(m * 100 + c * 10 + f, m), true);
						break;
					case 1:
						this.store.setInitialPosition(m, c, f, new Point2D(m, f));
						this.store.setObservation(m, c, f, new Point2D(m, f), MarkerStatus.INITIALIZED);
						break;
					case 2:
						this.store.setObservation(m, c, f, null, MarkerStatus.INVISIBLE);
						break;
					default:
						break;
					}
				}
			}
		}
		this.correction = new IdentityCorrection(this.store, 2);
	}

	private Observation[][][] copy() {
		Observation[][][] state = new Observation[MARKERS][CAMS][FRAMES];
		for (int m = 0; m < MARKERS; m++) {
			for (int c = 0; c < CAMS; c++) {
				for (int f = 0; f < FRAMES; f++) {
					state[m][c][f] = this.store.getObservation(m, c, f);
				}
			}
		}
		return state;
	}

	private void assertUnchanged(Observation[][][] before) {
		for (int m = 0; m < MARKERS; m++) {
			for (int c = 0; c < CAMS; c++) {
				for (int f = 0; f < FRAMES; f++) {
					assertEquals(before[m][c][f], this.store.getObservation(m, c, f));
				}
			}
		}
	}

	@Test
	public void swapsTwoAnimalsInOneViewOnly() {
		Observation[][][] before = this.copy();

		this.correction.swapAnimals(1, 4);

		for (int m = 0; m < MARKERS; m++) {
			for (int c = 0; c < CAMS; c++) {
				for (int f = 0; f < FRAMES; f++) {
					Observation expected = c == 1 && f == 4 ? before[(m + 17) % MARKERS][c][f] : before[m][c][f];
					assertEquals(expected, this.store.getObservation(m, c, f), "marker " + m + " cam " + c + " frame " + f);
				}
			}
		}
	}

	@Test
	public void swapIsAnInvolution() {
		Observation[][][] before = this.copy();
		MarkerRange a = new MarkerRange(0, 17);
		MarkerRange b = new MarkerRange(17, 34);
		this.correction.swapAnimals(2, 3, a, b);
		this.correction.swapAnimals(2, 3, a, b);
		this.assertUnchanged(before);
	}

	@Test
	public void swapsExplicitSubRanges() {
		Observation[][][] before = this.copy();
		this.correction.swapAnimals(0, 0, new MarkerRange(2, 4), new MarkerRange(20, 22));
		assertEquals(before[20][0][0], this.store.getObservation(2, 0, 0));
		assertEquals(before[3][0][0], this.store.getObservation(21, 0, 0));
		assertEquals(before[4][0][0], this.store.getObservation(4, 0, 0));
	}

	@Test
	public void rejectsOtherAnimalCounts() {
		Observation[][][] before = this.copy();
		IdentityCorrection threeAnimals = new IdentityCorrection(this.store, 3);
		assertThrows(UnsupportedAnimalCountException.class, () -> threeAnimals.swapAnimals(0, 0));
		this.assertUnchanged(before);
	}

	@Test
	public void rejectsBadRangesWithoutWriting() {
		Observation[][][] before = this.copy();
		assertThrows(InvalidRangeException.class,
				() -> this.correction.swapAnimals(0, 0, new MarkerRange(0, 3), new MarkerRange(17, 19)));
		assertThrows(InvalidRangeException.class,
				() -> this.correction.swapAnimals(0, 0, new MarkerRange(0, 10), new MarkerRange(5, 15)));
		assertThrows(InvalidRangeException.class,
				() -> this.correction.swapAnimals(0, 0, new MarkerRange(0, 5), new MarkerRange(30, 35)));
		assertThrows(IndexOutOfBoundsException.class, () -> this.correction.swapAnimals(CAMS, 0));
		this.assertUnchanged(before);
	}

}
