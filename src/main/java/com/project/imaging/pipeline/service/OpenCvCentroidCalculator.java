package com.project.imaging.pipeline.service;

import com.project.imaging.pipeline.DTOs.Centroid;
import com.project.imaging.pipeline.DTOs.WeightedMask;
import com.project.imaging.pipeline.exceptions.CoordinateExtractionException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.opencv.imgproc.Moments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Renders the mask into a dense frame-sized intensity image and takes its raw image moments,
 * i.e. the weighted centroid over the whole frame.
 */
@Service
@ConditionalOnProperty(name = "pipeline.centroid.method", havingValue = "opencv")
public class OpenCvCentroidCalculator implements CentroidCalculator {
    private static final Logger log = LoggerFactory.getLogger(OpenCvCentroidCalculator.class);

    private static final boolean LOADED;

    static {
        boolean loaded = false;
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            log.info("OpenCV loaded successfully");
        } catch (Exception | LinkageError e) {
            log.error("Failed to load OpenCV", e);
        }
        LOADED = loaded;
    }

    public static boolean isAvailable() {
        return LOADED;
    }

    @Override
    public Centroid weightedCentroid(WeightedMask mask) {
        if (!LOADED) {
            throw new IllegalStateException("OpenCV native library is not available");
        }
        double[] frame = new double[mask.width() * mask.height()];
        // row-major image, one row per y
        for (int i = 0; i < mask.size(); i++) {
            frame[mask.y(i) * mask.width() + mask.x(i)] = mask.weight(i);
        }
        Mat image = new Mat(mask.height(), mask.width(), CvType.CV_64FC1);
        try {
            image.put(0, 0, frame);
            Moments moments = Imgproc.moments(image, false);
            if (moments.m00 == 0) {
                throw new CoordinateExtractionException(
                        "Mask of trace " + mask.traceId() + " has zero total weight; centroid undefined");
            }
            Centroid centroid = new Centroid(moments.m10 / moments.m00 + 0.5, moments.m01 / moments.m00 + 0.5);
            log.debug("Trace {}: OpenCV centroid ({}, {})", mask.traceId(), centroid.x(), centroid.y());
            return centroid;
        } finally {
            image.release();
        }
    }
}
