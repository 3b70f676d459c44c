package com.project.imaging.pipeline.service;

import com.project.imaging.pipeline.DTOs.Centroid;
import com.project.imaging.pipeline.DTOs.WeightedMask;
import com.project.imaging.pipeline.exceptions.CoordinateExtractionException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Sums over the mask pixels only. Pixels outside the mask have zero intensity, so this equals
 * the centroid of the full frame image.
 */
@Service
@ConditionalOnProperty(name = "pipeline.centroid.method", havingValue = "sparse", matchIfMissing = true)
public class SparseCentroidCalculator implements CentroidCalculator {

    @Override
    public Centroid weightedCentroid(WeightedMask mask) {
        double sumW = 0, sumX = 0, sumY = 0;
        for (int i = 0; i < mask.size(); i++) {
            double w = mask.weight(i);
            if (w == 0) continue;
            sumW += w;
            sumX += (mask.x(i) + 0.5) * w;
            sumY += (mask.y(i) + 0.5) * w;
        }
        if (sumW == 0) {
            throw new CoordinateExtractionException(
                    "Mask of trace " + mask.traceId() + " has zero total weight; centroid undefined");
        }
        return new Centroid(sumX / sumW, sumY / sumW);
    }
}
