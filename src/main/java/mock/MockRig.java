package mock;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import Jama.Matrix;
import label3d.Camera;
import toolbox.Utils;
import types.CameraCalibration;
import types.Point2D;
import types.Point3D;
import types.Skeleton;

/**
 * Synthetic capture setup: a ring of cameras around the origin, all looking at it, and animals
 * whose markers move inside a small volume there. Projections are exact, so anything
 * triangulated from them should land back on the generated points.
 */
public class MockRig {

	public static final int WIDTH = 1280;
	public static final int HEIGHT = 1024;
	public static final double FOCAL = 1200;

	protected int nCams;
	protected double radius;
	protected double height;
	protected double[] radial = new double[] { 0, 0, 0 };
	protected double[] tangential = new double[] { 0, 0 };

	public MockRig(int nCams, double radius, double height) {
		this.nCams = nCams;
		this.radius = radius;
		this.height = height;
	}

	public MockRig withDistortion(double[] radial, double[] tangential) {
		this.radial = radial.clone();
		this.tangential = tangential.clone();
		return this;
	}

	public static Matrix getK() {
		Matrix K = Matrix.identity(3, 3);
		K.set(0, 0, FOCAL);
		K.set(1, 1, FOCAL);
		K.set(0, 2, WIDTH / 2.0);
		K.set(1, 2, HEIGHT / 2.0);
		return K;
	}

	public List<CameraCalibration> getCalibrations() {
		List<CameraCalibration> calibrations = new ArrayList<CameraCalibration>();
		for (int i = 0; i < this.nCams; i++) {
			double angle = 2 * Math.PI * i / this.nCams;
			Point3D center = new Point3D(this.radius * Math.cos(angle), this.radius * Math.sin(angle), this.height);
			calibrations.add(this.lookAt("Camera" + (i + 1), center, new Point3D(0, 0, 0)));
		}
		return calibrations;
	}

	/**
	 * Calibration of a camera at center whose optical axis passes through target, with image y
	 * pointing toward world -z.
	 */
	public CameraCalibration lookAt(String name, Point3D center, Point3D target) {
		Matrix z = Utils.normalize(target.getMatrix().minus(center.getMatrix()));
		Matrix down = new Matrix(new double[] { 0, 0, -1 }, 3);
		Matrix x = Utils.normalize(Utils.crossProduct(down, z));
		Matrix y = Utils.crossProduct(z, x);

		Matrix R = new Matrix(3, 3);
		R.setMatrix(0, 0, 0, 2, x.transpose());
		R.setMatrix(1, 1, 0, 2, y.transpose());
		R.setMatrix(2, 2, 0, 2, z.transpose());
		Matrix t = R.times(center.getMatrix()).times(-1);

		CameraCalibration c = new CameraCalibration();
		c.setName(name);
		c.setK(getK());
		c.setRadialDistortion(this.radial.clone());
		c.setTangentialDistortion(this.tangential.clone());
		c.setImageHeight(HEIGHT);
		c.setImageWidth(WIDTH);
		c.setRotation(R);
		c.setTranslation(t);
		return c;
	}

	// skeleton of nAnimals identical chains, joint names prefixed per animal
	public static Skeleton chainSkeleton(int nAnimals, int markersPerAnimal) {
		List<String> names = new ArrayList<String>();
		for (int a = 0; a < nAnimals; a++) {
			for (int m = 0; m < markersPerAnimal; m++) {
				names.add("Animal" + (a + 1) + "_Joint" + (m + 1));
			}
		}
		Skeleton skeleton = new Skeleton(names);
		for (int a = 0; a < nAnimals; a++) {
			for (int m = 0; m + 1 < markersPerAnimal; m++) {
				int from = a * markersPerAnimal + m;
				skeleton.addSegment(from, from + 1, a == 0 ? 1 : 0, 0, a == 0 ? 0 : 1);
			}
		}
		return skeleton;
	}

	/**
	 * Marker positions laid out [frame][3 * marker + axis], each animal in its own region of a
	 * 0.4 wide volume around the origin.
	 */
	public static double[][] syntheticPoints(int nAnimals, int markersPerAnimal, int nFrames, long seed) {
		Random random = new Random(seed);
		int nMarkers = nAnimals * markersPerAnimal;
		double[][] points = new double[nFrames][3 * nMarkers];
		for (int f = 0; f < nFrames; f++) {
			for (int m = 0; m < nMarkers; m++) {
				int animal = m / markersPerAnimal;
				double offset = nAnimals == 1 ? 0 : -0.1 + 0.2 * animal / (nAnimals - 1);
				points[f][3 * m] = offset + (random.nextDouble() - 0.5) * 0.1;
				points[f][3 * m + 1] = (random.nextDouble() - 0.5) * 0.2;
				points[f][3 * m + 2] = (random.nextDouble() - 0.5) * 0.2;
			}
		}
		return points;
	}

	// pixel of a world point in a camera, or null when it is behind the camera or off screen
	public static Point2D observe(Camera camera, Point3D point, boolean applyDistortion) {
		if (camera.worldPose().transformPoint(point).getZ() <= 0) {
			return null;
		}
		Point2D pixel = camera.project(point, applyDistortion);
		if (pixel.getX() < 0 || pixel.getY() < 0 || pixel.getX() >= WIDTH || pixel.getY() >= HEIGHT) {
			return null;
		}
		return pixel;
	}

}
