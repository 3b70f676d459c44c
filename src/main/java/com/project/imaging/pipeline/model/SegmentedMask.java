package com.project.imaging.pipeline.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

/** Pixel mask of one segmented cell (upstream, read-only). */
@Entity
@Table(name = "segmented_mask")
@IdClass(TraceKey.class)
public class SegmentedMask {

    @Id
    @Column(name = "animal_id")
    private int animalId;

    @Id
    @Column(name = "session")
    private int session;

    @Id
    @Column(name = "scan_idx")
    private int scanIdx;

    @Id
    @Column(name = "extract_method")
    private int extractMethod;

    @Id
    @Column(name = "slice")
    private int slice;

    @Id
    @Column(name = "trace_id")
    private int traceId;

    /** column-major linear pixel indices, rows fastest */
    @Column(name = "mask_pixels", nullable = false)
    @Convert(converter = IntArrayJsonConverter.class)
    private int[] maskPixels;

    /** one weight per entry of maskPixels */
    @Column(name = "mask_weights", nullable = false)
    @Convert(converter = DoubleArrayJsonConverter.class)
    private double[] maskWeights;

    protected SegmentedMask() {}

    public SegmentedMask(SegmentationKey key, int traceId, int[] maskPixels, double[] maskWeights) {
        this.animalId = key.getAnimalId();
        this.session = key.getSession();
        this.scanIdx = key.getScanIdx();
        this.extractMethod = key.getExtractMethod();
        this.slice = key.getSlice();
        this.traceId = traceId;
        this.maskPixels = maskPixels;
        this.maskWeights = maskWeights;
    }

    public int getTraceId() { return traceId; }
    public int[] getMaskPixels() { return maskPixels; }
    public double[] getMaskWeights() { return maskWeights; }
}
