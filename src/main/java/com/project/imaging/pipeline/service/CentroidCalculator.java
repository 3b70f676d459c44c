package com.project.imaging.pipeline.service;

import com.project.imaging.pipeline.DTOs.Centroid;
import com.project.imaging.pipeline.DTOs.WeightedMask;

/**
 * Weighted center of mass of a mask, in pixel units with pixel centers at {@code +0.5}.
 * Implementations must fail with a
 * {@link com.project.imaging.pipeline.exceptions.CoordinateExtractionException} when the
 * mask carries no weight, instead of returning NaN or a default point.
 */
public interface CentroidCalculator {

    Centroid weightedCentroid(WeightedMask mask);
}
