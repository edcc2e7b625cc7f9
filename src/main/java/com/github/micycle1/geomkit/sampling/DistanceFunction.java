package com.github.micycle1.geomkit.sampling;

import com.github.micycle1.geomkit.Point2D;

/**
 * Metric used by {@link PoissonDiscSampler} to test candidate spacing.
 * Implementations must be symmetric, non-negative and zero only for equal
 * points.
 */
@FunctionalInterface
public interface DistanceFunction {

	DistanceFunction EUCLIDEAN = Point2D::distance;

	double distance(Point2D p, Point2D q);
}
