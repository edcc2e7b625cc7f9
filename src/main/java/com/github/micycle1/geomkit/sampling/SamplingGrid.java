package com.github.micycle1.geomkit.sampling;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleSupplier;

import com.github.micycle1.geomkit.Point2D;

/**
 * Working state of a single sampling run: the acceleration grid and the active
 * queue. Coordinates are local to the region, i.e. in [0,width)x[0,height).
 * <p>
 * Cell size is r/sqrt(2), so every cell holds at most one accepted point and
 * any conflicting point lies within the surrounding 5x5 block of cells.
 */
final class SamplingGrid {

	private final double r;
	private final double cellSize;
	private final double width;
	private final double height;
	private final DistanceFunction dist;

	final int gridWidth;
	final int gridHeight;
	private final Point2D[] cells;
	private final List<Point2D> active = new ArrayList<>();

	SamplingGrid(double r, double width, double height, DistanceFunction dist) {
		this.r = r;
		this.cellSize = r / Math.sqrt(2);
		this.width = width;
		this.height = height;
		this.dist = dist;

		this.gridWidth = (int) Math.ceil(width / cellSize);
		this.gridHeight = (int) Math.ceil(height / cellSize);
		long capacity = (long) gridWidth * gridHeight;
		if (capacity > Integer.MAX_VALUE - 8) {
			throw new IllegalArgumentException("Region " + width + "x" + height + " is too large for radius " + r + " (" + capacity + " cells)");
		}
		this.cells = new Point2D[(int) capacity];
	}

	boolean contains(double x, double y) {
		return 0 <= x && x < width && 0 <= y && y < height;
	}

	/**
	 * True if no occupied cell in the 5x5 neighbourhood of p holds a point within
	 * distance r (inclusive).
	 */
	boolean fits(Point2D p) {
		int gx = cellX(p);
		int gy = cellY(p);
		int yMin = Math.max(gy - 2, 0);
		int yMax = Math.min(gy + 3, gridHeight);
		int xMax = Math.min(gx + 3, gridWidth);
		for (int x = Math.max(gx - 2, 0); x < xMax; x++) {
			for (int y = yMin; y < yMax; y++) {
				Point2D q = cells[x + y * gridWidth];
				if (q != null && dist.distance(p, q) <= r) {
					return false;
				}
			}
		}
		return true;
	}

	/** Stores p in its cell and marks it active. */
	void accept(Point2D p) {
		cells[cellX(p) + cellY(p) * gridWidth] = p;
		active.add(p);
	}

	boolean hasActive() {
		return !active.isEmpty();
	}

	/** Removes and returns a uniformly chosen active point (swap-with-last). */
	Point2D pollActive(DoubleSupplier rand) {
		int i = (int) (rand.getAsDouble() * active.size());
		int last = active.size() - 1;
		Point2D p = active.get(i);
		active.set(i, active.get(last));
		active.remove(last);
		return p;
	}

	/**
	 * Accepted points in cell order, shifted by (dx, dy). The shift can round a
	 * coordinate up to dx + width, so results are pulled back below the open
	 * upper bound.
	 */
	List<Point2D> collect(double dx, double dy) {
		double xMax = dx + width;
		double yMax = dy + height;
		List<Point2D> out = new ArrayList<>();
		for (Point2D p : cells) {
			if (p != null) {
				Point2D q = p.translate(dx, dy);
				if (q.getX() >= xMax || q.getY() >= yMax) {
					q = new Point2D(Math.min(q.getX(), Math.nextDown(xMax)), Math.min(q.getY(), Math.nextDown(yMax)));
				}
				out.add(q);
			}
		}
		return out;
	}

	// clamped: x / cellSize can round up to gridWidth for x just below width
	private int cellX(Point2D p) {
		return Math.min((int) Math.floor(p.getX() / cellSize), gridWidth - 1);
	}

	private int cellY(Point2D p) {
		return Math.min((int) Math.floor(p.getY() / cellSize), gridHeight - 1);
	}
}
