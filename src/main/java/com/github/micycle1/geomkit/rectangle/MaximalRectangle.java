package com.github.micycle1.geomkit.rectangle;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maximal-area axis-aligned rectangle of filled cells in an occupancy matrix.
 * <p>
 * Each row is reduced to a histogram of "filled cells directly above,
 * inclusive" and handed to {@link HistogramRectangle#largest(int[])}, giving
 * O(rows * cols) overall. Cells with a value &gt; 0 count as filled. On equal
 * areas the rectangle found first (earliest row, then leftmost) wins.
 * <p>
 * Corners are {@code [row, col]} pairs. For a matrix without filled cells the
 * result is empty: area 0, min corner {@code [0, -1]}, max corner
 * {@code [-1, -1]}.
 */
public final class MaximalRectangle {

	private static final Logger LOGGER = LoggerFactory.getLogger(MaximalRectangle.class);

	private final int minRow;
	private final int minCol;
	private final int maxRow;
	private final int maxCol;
	private final long area;

	private MaximalRectangle(int minRow, int minCol, int maxRow, int maxCol, long area) {
		this.minRow = minRow;
		this.minCol = minCol;
		this.maxRow = maxRow;
		this.maxCol = maxCol;
		this.area = area;
	}

	public static MaximalRectangle of(int[][] counts) {
		boolean[][] filled = new boolean[counts.length][];
		for (int i = 0; i < counts.length; i++) {
			filled[i] = new boolean[counts[i].length];
			for (int j = 0; j < counts[i].length; j++) {
				filled[i][j] = counts[i][j] > 0;
			}
		}
		return of(filled);
	}

	public static MaximalRectangle of(double[][] counts) {
		boolean[][] filled = new boolean[counts.length][];
		for (int i = 0; i < counts.length; i++) {
			filled[i] = new boolean[counts[i].length];
			for (int j = 0; j < counts[i].length; j++) {
				filled[i][j] = counts[i][j] > 0;
			}
		}
		return of(filled);
	}

	/**
	 * @param filled rectangular occupancy matrix, indexed [row][col]
	 * @throws IllegalArgumentException if rows differ in length
	 */
	public static MaximalRectangle of(boolean[][] filled) {
		int rows = filled.length;
		int cols = rows == 0 ? 0 : filled[0].length;
		for (int row = 1; row < rows; row++) {
			if (filled[row].length != cols) {
				throw new IllegalArgumentException("Matrix is ragged: row " + row + " has " + filled[row].length + " columns, expected " + cols);
			}
		}

		int[] heights = new int[cols];
		long best = 0;
		int left = -1, right = -1, height = -1;
		int bottom = 0;

		for (int row = 0; row < rows; row++) {
			for (int col = 0; col < cols; col++) {
				heights[col] = filled[row][col] ? heights[col] + 1 : 0;
			}
			HistogramRectangle local = HistogramRectangle.largest(heights);
			if (local.getArea() > best) {
				best = local.getArea();
				left = local.getLeft();
				right = local.getRight();
				height = local.getHeight();
				bottom = row - height;
			}
		}

		MaximalRectangle result = new MaximalRectangle(bottom, left, bottom + height, right, best);
		LOGGER.debug("Maximal rectangle in {}x{} matrix: {}", rows, cols, result);
		return result;
	}

	/** Top-left corner as {@code [row, col]}. */
	public int[] getMinCorner() {
		return new int[] { minRow, minCol };
	}

	/** Bottom-right corner as {@code [row, col]}, inclusive. */
	public int[] getMaxCorner() {
		return new int[] { maxRow, maxCol };
	}

	public long getArea() {
		return area;
	}

	public boolean isEmpty() {
		return area == 0;
	}

	@Override
	public String toString() {
		return "MaximalRectangle[" + Arrays.toString(getMinCorner()) + " - " + Arrays.toString(getMaxCorner()) + ", area=" + area + "]";
	}
}
