package com.project.imaging.pipeline.DTOs;

/**
 * Weighted center of mass in pixel units. Pixel {@code (col, row)} covers
 * {@code [col, col+1) x [row, row+1)}, so its center sits at {@code (col + 0.5, row + 0.5)}.
 */
public record Centroid(double x, double y) {}
