package com.github.micycle1.geomkit;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class CircleRectangleIntersectionTest {

	private static final double EPS = 1e-12;

	@Test
	void rectangleContainingCircleGivesFullDisc() {
		assertEquals(4 * Math.PI, CircleRectangleIntersection.area(2, 1, 1, -5, -5, 5, 5), EPS);
		// tight bounding box
		assertEquals(Math.PI, CircleRectangleIntersection.area(1, 0, 0, -1, -1, 1, 1), EPS);
	}

	@Test
	void rectangleOutsideCircleGivesZero() {
		assertEquals(0, CircleRectangleIntersection.area(1, 0, 0, 10, 10, 12, 12), EPS);
		assertEquals(0, CircleRectangleIntersection.area(1, 0, 0, -3, -3, -2, 3), EPS);
		// touches the circle at a single point
		assertEquals(0, CircleRectangleIntersection.area(1, 0, 0, 1, -1, 2, 1), EPS);
		// outside the disc but inside its bounding box corner
		assertEquals(0, CircleRectangleIntersection.area(1, 0, 0, 0.8, 0.8, 1, 1), EPS);
	}

	@Test
	void halfAndQuarterDiscs() {
		double r = 3;
		double disc = Math.PI * r * r;
		assertEquals(disc / 2, CircleRectangleIntersection.area(r, 2, -1, 2, -10, 10, 10), 1e-10);
		assertEquals(disc / 2, CircleRectangleIntersection.area(r, 2, -1, -10, -10, 10, -1), 1e-10);
		assertEquals(disc / 4, CircleRectangleIntersection.area(r, 2, -1, 2, -1, 20, 20), 1e-10);
		assertEquals(disc / 4, CircleRectangleIntersection.area(r, 2, -1, -20, -20, 2, -1), 1e-10);
	}

	@Test
	void circularSegment() {
		// segment of the unit disc with x >= 0.5: acos(0.5) - 0.5 * sqrt(0.75)
		double expected = Math.acos(0.5) - 0.5 * Math.sqrt(0.75);
		assertEquals(expected, CircleRectangleIntersection.area(1, 0, 0, 0.5, -2, 2, 2), EPS);
	}

	@Test
	void degenerateRectangleHasNoArea() {
		assertEquals(0, CircleRectangleIntersection.area(1, 0, 0, 0.2, -1, 0.2, 1), EPS);
	}

	@ParameterizedTest
	@ValueSource(longs = { 1L, 42L, 12345L })
	void translationDoesNotChangeArea(long seed) {
		Random rnd = new Random(seed);
		for (int i = 0; i < 50; i++) {
			double r = 0.1 + 3 * rnd.nextDouble();
			double cx = rnd.nextDouble() * 4 - 2, cy = rnd.nextDouble() * 4 - 2;
			double x0 = rnd.nextDouble() * 6 - 3, y0 = rnd.nextDouble() * 6 - 3;
			double x1 = x0 + rnd.nextDouble() * 4, y1 = y0 + rnd.nextDouble() * 4;
			double tx = rnd.nextDouble() * 200 - 100, ty = rnd.nextDouble() * 200 - 100;

			double a = CircleRectangleIntersection.area(r, cx, cy, x0, y0, x1, y1);
			double b = CircleRectangleIntersection.area(r, cx + tx, cy + ty, x0 + tx, y0 + ty, x1 + tx, y1 + ty);
			assertEquals(a, b, 1e-9, "seed=" + seed + " i=" + i);
		}
	}

	@ParameterizedTest
	@ValueSource(longs = { 7L, 2024L })
	void matchesNumericalIntegration(long seed) {
		Random rnd = new Random(seed);
		for (int i = 0; i < 25; i++) {
			double r = 0.5 + 2 * rnd.nextDouble();
			double cx = rnd.nextDouble() * 4 - 2, cy = rnd.nextDouble() * 4 - 2;
			double xa = rnd.nextDouble() * 8 - 4, xb = rnd.nextDouble() * 8 - 4;
			double ya = rnd.nextDouble() * 8 - 4, yb = rnd.nextDouble() * 8 - 4;
			double x0 = Math.min(xa, xb), x1 = Math.max(xa, xb);
			double y0 = Math.min(ya, yb), y1 = Math.max(ya, yb);

			double exact = CircleRectangleIntersection.area(r, cx, cy, x0, y0, x1, y1);
			assertTrue(exact >= 0);
			assertEquals(integrate(r, cx, cy, x0, y0, x1, y1), exact, 1e-4, "seed=" + seed + " i=" + i);
		}
	}

	@ParameterizedTest
	@ValueSource(longs = { 3L, 77L, 4096L })
	void disjointOrTouchingRectanglesNeverGoNegative(long seed) {
		Random rnd = new Random(seed);
		for (int i = 0; i < 20000; i++) {
			double r = 0.01 + 5 * rnd.nextDouble();
			double cx = rnd.nextDouble() * 20 - 10, cy = rnd.nextDouble() * 20 - 10;
			double w = rnd.nextDouble() * 4, h = rnd.nextDouble() * 4;
			double x0, y0;
			switch (rnd.nextInt(4)) {
			case 0: // touching the right edge of the circle
				x0 = cx + r;
				y0 = cy - h * rnd.nextDouble();
				break;
			case 1: // touching the top of the circle
				x0 = cx - w * rnd.nextDouble();
				y0 = cy + r;
				break;
			case 2: // beyond the bounding box
				x0 = cx + r + rnd.nextDouble() * 3;
				y0 = cy - r - h - rnd.nextDouble() * 3;
				break;
			default: // inside the bounding box corner, outside the disc
				x0 = cx + r * 0.75;
				y0 = cy + r * 0.75;
				w = r * 0.25;
				h = r * 0.25;
				break;
			}
			double a = CircleRectangleIntersection.area(r, cx, cy, x0, y0, x0 + w, y0 + h);
			assertTrue(a >= 0, "negative area " + a + " seed=" + seed + " i=" + i);
			assertEquals(0, a, 1e-9, "seed=" + seed + " i=" + i);
		}
	}

	@Test
	void continuousAcrossCaseBoundaries() {
		double d = 1e-9;
		double[] vs = { -1.5, -0.7, -0.2, 0, 0.3, 0.9, 1.4 };
		for (double v : vs) {
			for (double u : new double[] { -1, 0, 1 }) {
				assertEquals(CircleRectangleIntersection.quadrant(u - d, v), CircleRectangleIntersection.quadrant(u + d, v), 1e-6, "u=" + u + " v=" + v);
				assertEquals(CircleRectangleIntersection.quadrant(v, u - d), CircleRectangleIntersection.quadrant(v, u + d), 1e-6, "u=" + v + " v=" + u);
			}
		}
		// across the unit circle itself
		for (int k = 0; k < 32; k++) {
			double t = 2 * Math.PI * k / 32;
			double cu = Math.cos(t), cv = Math.sin(t);
			assertEquals(CircleRectangleIntersection.quadrant(cu * (1 - d), cv * (1 - d)), CircleRectangleIntersection.quadrant(cu * (1 + d), cv * (1 + d)), 1e-6,
					"theta=" + t);
		}
		assertEquals(0, CircleRectangleIntersection.halfPlane(-1), EPS);
		assertEquals(Math.PI / 2, CircleRectangleIntersection.halfPlane(0), EPS);
		assertEquals(Math.PI, CircleRectangleIntersection.halfPlane(1), EPS);
	}

	@Test
	void shiftingEdgeAcrossCircleBoundaryIsSmooth() {
		double d = 1e-9;
		double inner = CircleRectangleIntersection.area(2, 0, 0, 2 - d, -1, 5, 1);
		double outer = CircleRectangleIntersection.area(2, 0, 0, 2 + d, -1, 5, 1);
		assertEquals(inner, outer, 1e-6);
	}

	@Test
	void pointOverload() {
		double a = CircleRectangleIntersection.area(1.5, new Point2D(0.5, 0.5), new Point2D(0, 0), new Point2D(3, 2));
		assertEquals(CircleRectangleIntersection.area(1.5, 0.5, 0.5, 0, 0, 3, 2), a, 0);
	}

	@Test
	void invalidArgumentsAreRejected() {
		assertThrows(IllegalArgumentException.class, () -> CircleRectangleIntersection.area(0, 0, 0, 0, 0, 1, 1));
		assertThrows(IllegalArgumentException.class, () -> CircleRectangleIntersection.area(-2, 0, 0, 0, 0, 1, 1));
		assertThrows(IllegalArgumentException.class, () -> CircleRectangleIntersection.area(1, 0, 0, 1, 0, 0, 1));
		assertThrows(IllegalArgumentException.class, () -> CircleRectangleIntersection.area(1, 0, 0, 0, 1, 1, 0));
	}

	// midpoint rule over x of the vertical chord clipped to [y0, y1]
	private static double integrate(double r, double cx, double cy, double x0, double y0, double x1, double y1) {
		double lo = Math.max(x0, cx - r);
		double hi = Math.min(x1, cx + r);
		if (hi <= lo) {
			return 0;
		}
		int n = 20000;
		double dx = (hi - lo) / n;
		double sum = 0;
		for (int i = 0; i < n; i++) {
			double x = lo + (i + 0.5) * dx;
			double half = Math.sqrt(Math.max(0, r * r - (x - cx) * (x - cx)));
			sum += Math.max(0, Math.min(y1, cy + half) - Math.max(y0, cy - half)) * dx;
		}
		return sum;
	}
}
