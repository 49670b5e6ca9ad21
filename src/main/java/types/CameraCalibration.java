package types;

import Jama.Matrix;

/**
 * Raw calibration record of one camera, as read from a calibration file or a saved session.
 * 
 * The rotation is either a 3x3 matrix or a 3-element Rodrigues vector. In the ROW_VECTOR
 * convention (x_cam = x_world * r + t) both the rotation and the intrinsic matrix are stored
 * transposed. Camera construction converts everything to the column-vector convention.
 */
public class CameraCalibration {

	public enum PoseConvention {
		COLUMN_VECTOR, ROW_VECTOR
	}

	private String name = "";
	private Matrix K = Matrix.identity(3, 3);
	private double[] radialDistortion = new double[] { 0, 0, 0 };
	private double[] tangentialDistortion = new double[] { 0, 0 };
	private int imageHeight = 0;
	private int imageWidth = 0;
	private Matrix rotation = Matrix.identity(3, 3);
	private Matrix translation = new Matrix(3, 1);
	private PoseConvention convention = PoseConvention.COLUMN_VECTOR;

	public CameraCalibration() {

	}

	public CameraCalibration(CameraCalibration c) {
		this.name = c.name;
		this.K = c.K.copy();
		this.radialDistortion = c.radialDistortion.clone();
		this.tangentialDistortion = c.tangentialDistortion.clone();
		this.imageHeight = c.imageHeight;
		this.imageWidth = c.imageWidth;
		this.rotation = c.rotation.copy();
		this.translation = c.translation.copy();
		this.convention = c.convention;
	}

	public boolean isRodrigues() {
		return rotation.getRowDimension() * rotation.getColumnDimension() == 3;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public Matrix getK() {
		return K;
	}

	public void setK(Matrix k) {
		K = k;
	}

	public double[] getRadialDistortion() {
		return radialDistortion;
	}

	public void setRadialDistortion(double[] radialDistortion) {
		this.radialDistortion = radialDistortion;
	}

	public double[] getTangentialDistortion() {
		return tangentialDistortion;
	}

	public void setTangentialDistortion(double[] tangentialDistortion) {
		this.tangentialDistortion = tangentialDistortion;
	}

	public int getImageHeight() {
		return imageHeight;
	}

	public void setImageHeight(int imageHeight) {
		this.imageHeight = imageHeight;
	}

	public int getImageWidth() {
		return imageWidth;
	}

	public void setImageWidth(int imageWidth) {
		this.imageWidth = imageWidth;
	}

	public Matrix getRotation() {
		return rotation;
	}

	public void setRotation(Matrix rotation) {
		this.rotation = rotation;
	}

	public Matrix getTranslation() {
		return translation;
	}

	public void setTranslation(Matrix translation) {
		this.translation = translation;
	}

	public PoseConvention getConvention() {
		return convention;
	}

	public void setConvention(PoseConvention convention) {
		this.convention = convention;
	}

}
