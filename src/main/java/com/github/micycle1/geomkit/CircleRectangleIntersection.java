package com.github.micycle1.geomkit;

/**
 * Exact area of the intersection between a circle and an axis-aligned
 * rectangle.
 * <p>
 * The rectangle corners are normalised against the circle (u = (x - xc) / r, v
 * = (y - yc) / r) and the area is assembled from a "disc CDF" Q(u, v), the area
 * of the unit disc with x &le; u and y &le; v. For a rectangle [u0,u1]x[v0,v1]
 * the unit-disc area is then Q(u1,v1) + Q(u0,v0) - Q(u0,v1) - Q(u1,v0), scaled
 * back by r&sup2;.
 */
public final class CircleRectangleIntersection {

	private CircleRectangleIntersection() {
	}

	/**
	 * Intersection area of the circle centred at (cx, cy) with the given radius and
	 * the rectangle with minimum corner (x0, y0) and maximum corner (x1, y1).
	 *
	 * @throws IllegalArgumentException if {@code radius <= 0} or the rectangle
	 *                                  corners are reversed
	 */
	public static double area(double radius, double cx, double cy, double x0, double y0, double x1, double y1) {
		if (!(radius > 0)) {
			throw new IllegalArgumentException("radius must be > 0, got " + radius);
		}
		if (x0 > x1 || y0 > y1) {
			throw new IllegalArgumentException("Rectangle min corner (" + x0 + ", " + y0 + ") exceeds max corner (" + x1 + ", " + y1 + ")");
		}
		double u0 = (x0 - cx) / radius;
		double v0 = (y0 - cy) / radius;
		double u1 = (x1 - cx) / radius;
		double v1 = (y1 - cy) / radius;
		// the four-term sum can leave a tiny negative residue for disjoint shapes
		return Math.max(0, radius * radius * unitRect(u0, v0, u1, v1));
	}

	public static double area(double radius, Point2D center, Point2D rectMin, Point2D rectMax) {
		return area(radius, center.getX(), center.getY(), rectMin.getX(), rectMin.getY(), rectMax.getX(), rectMax.getY());
	}

	// Area of the unit disc inside [u0,u1]x[v0,v1]
	static double unitRect(double u0, double v0, double u1, double v1) {
		return quadrant(u0, v0) + quadrant(u1, v1) - quadrant(u0, v1) - quadrant(u1, v0);
	}

	/**
	 * Area of the unit disc with x &le; u and y &le; v. The branch order matters:
	 * each case assumes the earlier ones have been ruled out.
	 */
	static double quadrant(double u, double v) {
		if (u * u + v * v <= 1) {
			return (halfPlane(u) + halfPlane(v)) / 2 - Math.PI / 4 + u * v;
		} else if (u <= -1 || v <= -1) {
			return 0;
		} else if (u >= 1 && v >= 1) {
			return Math.PI;
		} else if (u >= 1) {
			return halfPlane(v);
		} else if (v >= 1) {
			return halfPlane(u);
		} else if (u >= 0 && v >= 0) {
			return halfPlane(u) + halfPlane(v) - Math.PI;
		} else if (u >= 0 && v <= 0) {
			return halfPlane(v);
		} else if (u <= 0 && v >= 0) {
			return halfPlane(u);
		}
		return 0;
	}

	/** Area of the unit disc with one coordinate &le; u. */
	static double halfPlane(double u) {
		if (u >= 1) {
			return Math.PI;
		} else if (u > -1) {
			return Math.PI - Math.acos(u) + u * Math.sqrt(1 - u * u);
		}
		return 0;
	}
}
