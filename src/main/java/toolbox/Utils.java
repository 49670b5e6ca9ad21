package toolbox;

import org.ejml.data.DMatrixRMaj;

import Jama.Matrix;
import georegression.geometry.ConvertRotation3D_F64;
import georegression.struct.so.Rodrigues_F64;
import types.Point2D;

public class Utils {

	// half-up rounding to a number of decimals, the granularity at which 2D positions are compared
	public static double round(double value, int decimals) {
		double scale = Math.pow(10, decimals);
		return Math.round(value * scale) / scale;
	}

	public static boolean roundedEquals(Point2D a, Point2D b, int decimals) {
		return round(a.getX(), decimals) == round(b.getX(), decimals)
				&& round(a.getY(), decimals) == round(b.getY(), decimals);
	}

	public static Matrix rodriguesToMatrix(double rx, double ry, double rz) {
		Rodrigues_F64 rodrigues = new Rodrigues_F64();
		rodrigues.setParamVector(rx, ry, rz);
		DMatrixRMaj R = ConvertRotation3D_F64.rodriguesToMatrix(rodrigues, null);
		return DMatrixRMajToMatrix(R);
	}

	public static Matrix DMatrixRMajToMatrix(DMatrixRMaj m) {
		Matrix matrix = new Matrix(m.getNumRows(), m.getNumCols());
		for (int i = 0; i < m.getNumRows(); i++) {
			for (int j = 0; j < m.getNumCols(); j++) {
				matrix.set(i, j, m.get(i, j));
			}
		}
		return matrix;
	}

	public static boolean isFinite(Matrix m) {
		for (int i = 0; i < m.getRowDimension(); i++) {
			for (int j = 0; j < m.getColumnDimension(); j++) {
				if (!Double.isFinite(m.get(i, j))) {
					return false;
				}
			}
		}
		return true;
	}

	public static double[] pad(double[] values, int length) {
		double[] padded = new double[length];
		for (int i = 0; i < values.length && i < length; i++) {
			padded[i] = values[i];
		}
		return padded;
	}

	// return cross product (column vectors) of a and b (also column vectors)
	public static Matrix crossProduct(Matrix a, Matrix b) {
		Matrix cross = new Matrix(3, 1);
		double a1 = a.get(0, 0);
		double a2 = a.get(1, 0);
		double a3 = a.get(2, 0);
		double b1 = b.get(0, 0);
		double b2 = b.get(1, 0);
		double b3 = b.get(2, 0);

		cross.set(0, 0, a2 * b3 - a3 * b2);
		cross.set(1, 0, a3 * b1 - a1 * b3);
		cross.set(2, 0, a1 * b2 - a2 * b1);
		return cross;
	}

	public static Matrix normalize(Matrix v) {
		return v.times(1.0 / v.normF());
	}

}
