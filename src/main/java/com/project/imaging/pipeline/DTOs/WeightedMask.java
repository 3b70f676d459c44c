package com.project.imaging.pipeline.DTOs;

import com.project.imaging.pipeline.exceptions.CoordinateExtractionException;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;

/**
 * Validated mask of one trace in a frame of {@code width x height} pixels. Pixels are zero-based
 * column-major linear indices, so the row (y) varies fastest: {@code index = x * height + y}.
 * Each pixel appears at most once and carries one finite, non-negative weight.
 */
public final class WeightedMask {

    private final int traceId;
    private final int width;
    private final int height;
    private final int[] pixels;
    private final double[] weights;

    public WeightedMask(int traceId, int width, int height, int[] pixels, double[] weights) {
        if (pixels.length != weights.length) {
            throw new CoordinateExtractionException("Trace " + traceId + " has " + pixels.length
                    + " mask pixels but " + weights.length + " weights");
        }
        long frameSize = (long) width * height;
        BitSet seen = new BitSet();
        for (int i = 0; i < pixels.length; i++) {
            if (pixels[i] < 0 || pixels[i] >= frameSize) {
                throw new CoordinateExtractionException("Trace " + traceId + " has pixel index " + pixels[i]
                        + " outside the " + width + "x" + height + " frame");
            }
            if (seen.get(pixels[i])) {
                throw new CoordinateExtractionException("Trace " + traceId + " lists pixel " + pixels[i] + " twice");
            }
            seen.set(pixels[i]);
            if (!Double.isFinite(weights[i]) || weights[i] < 0) {
                throw new CoordinateExtractionException("Trace " + traceId + " has invalid weight "
                        + weights[i] + " at pixel " + pixels[i]);
            }
        }
        this.traceId = traceId;
        this.width = width;
        this.height = height;
        this.pixels = pixels.clone();
        this.weights = weights.clone();
    }

    /**
     * Shifts stored indices by {@code indexBase} and validates them against the frame.
     */
    public static WeightedMask of(int traceId, int[] storedPixels, double[] weights, int indexBase,
                                  FrameGeometry frame) {
        if (storedPixels == null || weights == null) {
            throw new CoordinateExtractionException("Trace " + traceId + " has no mask data");
        }
        int[] pixels = new int[storedPixels.length];
        for (int i = 0; i < storedPixels.length; i++) {
            pixels[i] = storedPixels[i] - indexBase;
        }
        return new WeightedMask(traceId, frame.pxWidth(), frame.pxHeight(), pixels, weights);
    }

    public int traceId() {
        return traceId;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int size() {
        return pixels.length;
    }

    public int pixel(int i) {
        return pixels[i];
    }

    public int x(int i) {
        return pixels[i] / height;
    }

    public int y(int i) {
        return pixels[i] % height;
    }

    public double weight(int i) {
        return weights[i];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeightedMask other)) return false;
        return traceId == other.traceId && width == other.width && height == other.height
                && Arrays.equals(pixels, other.pixels) && Arrays.equals(weights, other.weights);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(traceId, width, height);
        result = 31 * result + Arrays.hashCode(pixels);
        return 31 * result + Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        return "WeightedMask[traceId=" + traceId + ", " + width + "x" + height + ", " + pixels.length + " pixels]";
    }
}
