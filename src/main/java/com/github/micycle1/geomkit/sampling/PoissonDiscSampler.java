package com.github.micycle1.geomkit.sampling;

import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.function.DoubleSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.geomkit.Point2D;

/**
 * Blue-noise point sampling of an axis-aligned rectangular region, following
 * Robert Bridson's "Fast Poisson Disk Sampling in Arbitrary Dimensions"
 * (SIGGRAPH 2007).
 * <p>
 * Produces a set of points, no two of which are within distance {@code r} of
 * each other under the configured {@link DistanceFunction}, filling the region
 * until no active point can spawn another. The number of points is not chosen
 * by the caller: it follows from {@code r}, the attempt count {@code k} and the
 * region area.
 * <p>
 * Usage:
 *
 * <pre>
 * PoissonDiscSampler sampler = new PoissonDiscSampler(0.05);
 * sampler.setRegion(0, 0, 2, 1);
 * List&lt;Point2D&gt; pts = sampler.sample(new Random(1337));
 * </pre>
 *
 * Instances only hold configuration; every call to {@code sample} allocates
 * its own grid and active queue. Mutating an instance is not thread-safe.
 */
public class PoissonDiscSampler {

	private static final Logger LOGGER = LoggerFactory.getLogger(PoissonDiscSampler.class);

	public static final int DEFAULT_MAX_ATTEMPTS = 30;

	private static final double TAU = 2 * Math.PI;

	private final double r;

	private double minX = 0;
	private double minY = 0;
	private double width = 1;
	private double height = 1;
	private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
	private DistanceFunction distanceFunction = DistanceFunction.EUCLIDEAN;

	/**
	 * @param r minimum separation between samples; must be &gt; 0
	 */
	public PoissonDiscSampler(double r) {
		if (!(r > 0)) {
			throw new IllegalArgumentException("r must be > 0, got " + r);
		}
		this.r = r;
	}

	/**
	 * One-shot sampling with every parameter explicit.
	 *
	 * @param r          minimum separation; points at exactly {@code r} are
	 *                   rejected
	 * @param minX       region origin x
	 * @param minY       region origin y
	 * @param width      region width, &gt; 0
	 * @param height     region height, &gt; 0
	 * @param k          candidate attempts per active point, &ge; 1
	 * @param dist       metric used for spacing tests
	 * @param rand       uniform source in [0, 1)
	 * @return samples within [minX, minX+width) x [minY, minY+height)
	 */
	public static List<Point2D> sample(double r, double minX, double minY, double width, double height, int k, DistanceFunction dist,
			DoubleSupplier rand) {
		PoissonDiscSampler sampler = new PoissonDiscSampler(r);
		sampler.setRegion(minX, minY, width, height);
		sampler.setMaxAttempts(k);
		sampler.setDistanceFunction(dist);
		return sampler.sample(rand);
	}

	public PoissonDiscSampler setRegion(double minX, double minY, double width, double height) {
		if (!(width > 0) || !(height > 0)) {
			throw new IllegalArgumentException("Region dimensions must be > 0, got " + width + "x" + height);
		}
		this.minX = minX;
		this.minY = minY;
		this.width = width;
		this.height = height;
		return this;
	}

	public PoissonDiscSampler setMaxAttempts(int k) {
		if (k < 1) {
			throw new IllegalArgumentException("k must be >= 1, got " + k);
		}
		this.maxAttempts = k;
		return this;
	}

	public PoissonDiscSampler setDistanceFunction(DistanceFunction dist) {
		this.distanceFunction = Objects.requireNonNull(dist, "dist must not be null");
		return this;
	}

	public double getRadius() {
		return r;
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	/**
	 * Samples using a {@link Random}. A null generator is replaced by a fresh
	 * unseeded one.
	 */
	public List<Point2D> sample(Random rnd) {
		if (rnd == null) {
			rnd = new Random();
		}
		return sample(rnd::nextDouble);
	}

	/**
	 * Runs one sampling pass. Anything thrown by {@code rand} or the distance
	 * function propagates to the caller unchanged.
	 *
	 * @param rand uniform source in [0, 1)
	 * @return the accepted points in grid-cell order
	 */
	public List<Point2D> sample(DoubleSupplier rand) {
		Objects.requireNonNull(rand, "rand must not be null");
		SamplingGrid grid = new SamplingGrid(r, width, height, distanceFunction);

		grid.accept(new Point2D(width * rand.getAsDouble(), height * rand.getAsDouble()));

		while (grid.hasActive()) {
			Point2D q = grid.pollActive(rand);
			for (int i = 0; i < maxAttempts; i++) {
				double alpha = TAU * rand.getAsDouble();
				double d = r * Math.sqrt(3 * rand.getAsDouble() + 1);
				double px = q.getX() + d * Math.cos(alpha);
				double py = q.getY() + d * Math.sin(alpha);
				if (!grid.contains(px, py)) {
					continue;
				}
				Point2D p = new Point2D(px, py);
				if (grid.fits(p)) {
					grid.accept(p);
				}
			}
		}

		List<Point2D> samples = grid.collect(minX, minY);
		LOGGER.debug("Poisson-disc sampling (r={}, k={}) produced {} points on a {}x{} grid", r, maxAttempts, samples.size(), grid.gridWidth,
				grid.gridHeight);
		return samples;
	}
}
