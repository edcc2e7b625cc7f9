package com.github.micycle1.geomkit;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 3x3 rotation matrices about an arbitrary axis, built from the Euler-Rodrigues
 * parameters. Rotation is counter-clockwise by theta when looking down the axis
 * towards the origin.
 */
public final class RotationMatrix {

	private RotationMatrix() {
	}

	/**
	 * @param axis  rotation axis, length 3, need not be normalised
	 * @param theta rotation angle in radians
	 * @return a new row-major 3x3 matrix
	 */
	public static DMatrixRMaj about(double[] axis, double theta) {
		if (axis == null || axis.length != 3) {
			throw new IllegalArgumentException("axis must have exactly 3 components");
		}
		double norm = Math.sqrt(axis[0] * axis[0] + axis[1] * axis[1] + axis[2] * axis[2]);
		if (!(norm > 0)) {
			throw new IllegalArgumentException("axis must have non-zero length");
		}

		double s = Math.sin(theta / 2.0);
		double a = Math.cos(theta / 2.0);
		double b = -axis[0] / norm * s;
		double c = -axis[1] / norm * s;
		double d = -axis[2] / norm * s;

		double aa = a * a, bb = b * b, cc = c * c, dd = d * d;
		double bc = b * c, ad = a * d, ac = a * c, ab = a * b, bd = b * d, cd = c * d;

		return new DMatrixRMaj(3, 3, true, //
				aa + bb - cc - dd, 2 * (bc + ad), 2 * (bd - ac), //
				2 * (bc - ad), aa + cc - bb - dd, 2 * (cd + ab), //
				2 * (bd + ac), 2 * (cd - ab), aa + dd - bb - cc);
	}

	/** Rotates the 3-vector {@code v} about {@code axis} by {@code theta}. */
	public static double[] rotate(double[] axis, double theta, double[] v) {
		if (v == null || v.length != 3) {
			throw new IllegalArgumentException("v must have exactly 3 components");
		}
		DMatrixRMaj out = new DMatrixRMaj(3, 1);
		CommonOps_DDRM.mult(about(axis, theta), new DMatrixRMaj(3, 1, true, v), out);
		return out.getData().clone();
	}
}
