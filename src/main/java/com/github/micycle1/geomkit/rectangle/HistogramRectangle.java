package com.github.micycle1.geomkit.rectangle;

/**
 * Largest rectangle under a histogram, found with the classic monotonic index
 * stack in O(n).
 * <p>
 * {@link #getHeight()} is the limiting bar's value minus one. It is the row
 * offset {@link MaximalRectangle} subtracts from the current row to find the
 * top of the rectangle, not the rectangle's literal height.
 */
public final class HistogramRectangle {

	private static final HistogramRectangle NONE = new HistogramRectangle(0, -1, -1, -1);

	private final long area;
	private final int left;
	private final int right;
	private final int height;

	HistogramRectangle(long area, int left, int right, int height) {
		this.area = area;
		this.left = left;
		this.right = right;
		this.height = height;
	}

	/**
	 * Scans {@code heights} left to right. Ties keep the first rectangle found;
	 * with no positive area the result is (0, -1, -1, -1).
	 *
	 * @param heights non-negative bar heights
	 */
	public static HistogramRectangle largest(int[] heights) {
		int n = heights.length;
		int[] stack = new int[n];
		int top = 0; // stack size

		long maxArea = 0;
		int left = -1, right = -1, height = -1;

		int i = 0;
		while (i < n) {
			if (top == 0 || heights[stack[top - 1]] <= heights[i]) {
				stack[top++] = i++;
			} else {
				int bar = stack[--top];
				int width = top == 0 ? i : i - stack[top - 1] - 1;
				long area = (long) heights[bar] * width;
				if (area > maxArea) {
					maxArea = area;
					height = heights[bar] - 1;
					right = i - 1;
					left = top == 0 ? 0 : stack[top - 1] + 1;
				}
			}
		}
		// i == n: drain remaining bars
		while (top > 0) {
			int bar = stack[--top];
			int width = top == 0 ? i : i - stack[top - 1] - 1;
			long area = (long) heights[bar] * width;
			if (area > maxArea) {
				maxArea = area;
				height = heights[bar] - 1;
				right = i - 1;
				left = top == 0 ? 0 : stack[top - 1] + 1;
			}
		}

		if (maxArea == 0) {
			return NONE;
		}
		return new HistogramRectangle(maxArea, left, right, height);
	}

	public long getArea() {
		return area;
	}

	/** Leftmost bar index (inclusive), or -1. */
	public int getLeft() {
		return left;
	}

	/** Rightmost bar index (inclusive), or -1. */
	public int getRight() {
		return right;
	}

	/** Limiting bar value minus one, or -1. */
	public int getHeight() {
		return height;
	}

	@Override
	public String toString() {
		return "HistogramRectangle[area=" + area + ", left=" + left + ", right=" + right + ", height=" + height + "]";
	}
}
