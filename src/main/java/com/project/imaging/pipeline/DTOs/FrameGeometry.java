package com.project.imaging.pipeline.DTOs;

import com.project.imaging.pipeline.exceptions.CoordinateExtractionException;

/**
 * Pixel and physical extent of one scan frame. Maps pixel coordinates linearly onto micrometers
 * with the frame center as origin.
 */
public record FrameGeometry(int pxWidth, int pxHeight, double umWidth, double umHeight) {

    public FrameGeometry {
        if (pxWidth <= 0 || pxHeight <= 0) {
            throw new CoordinateExtractionException(
                    "Frame must have a positive pixel size, got " + pxWidth + "x" + pxHeight);
        }
        if (!(umWidth > 0) || !(umHeight > 0)) {
            throw new CoordinateExtractionException(
                    "Frame must have a positive physical size, got " + umWidth + "x" + umHeight + " um");
        }
    }

    public double xloc(double cx) {
        return cx / pxWidth * umWidth - umWidth / 2;
    }

    public double yloc(double cy) {
        return cy / pxHeight * umHeight - umHeight / 2;
    }
}
