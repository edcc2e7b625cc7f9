package com.github.micycle1.geomkit;

/**
 * Immutable (x, y) pair with value semantics.
 */
public final class Point2D {

	private final double x;
	private final double y;

	public Point2D(double x, double y) {
		this.x = x;
		this.y = y;
	}

	public double getX() {
		return x;
	}

	public double getY() {
		return y;
	}

	public Point2D translate(double dx, double dy) {
		return new Point2D(x + dx, y + dy);
	}

	/** Euclidean distance to {@code other}. */
	public double distance(Point2D other) {
		return Math.hypot(x - other.x, y - other.y);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Point2D)) {
			return false;
		}
		Point2D p = (Point2D) o;
		return Double.compare(x, p.x) == 0 && Double.compare(y, p.y) == 0;
	}

	@Override
	public int hashCode() {
		return 31 * Double.hashCode(x) + Double.hashCode(y);
	}

	@Override
	public String toString() {
		return "(" + x + ", " + y + ")";
	}
}
