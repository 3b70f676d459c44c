package com.project.imaging.pipeline.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

/**
 * Mask center of mass of a segmented cell. Computed from {@link SegmentedMask}, one row per
 * mask; rows are deleted and recreated, never updated.
 */
@Entity
@Table(name = "mask_coordinate")
@IdClass(TraceKey.class)
public class MaskCoordinate {

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

    /** (um) x location relative to the frame center */
    @Column(name = "xloc", nullable = false)
    private double xloc;

    /** (um) y location relative to the frame center */
    @Column(name = "yloc", nullable = false)
    private double yloc;

    /** (um) z location relative to the surface */
    @Column(name = "zloc", nullable = false)
    private double zloc;

    protected MaskCoordinate() {}

    public MaskCoordinate(SegmentationKey key, int traceId, double xloc, double yloc, double zloc) {
        this.animalId = key.getAnimalId();
        this.session = key.getSession();
        this.scanIdx = key.getScanIdx();
        this.extractMethod = key.getExtractMethod();
        this.slice = key.getSlice();
        this.traceId = traceId;
        this.xloc = xloc;
        this.yloc = yloc;
        this.zloc = zloc;
    }

    public SegmentationKey segmentationKey() {
        return new SegmentationKey(animalId, session, scanIdx, extractMethod, slice);
    }

    public int getTraceId() { return traceId; }
    public double getXloc() { return xloc; }
    public double getYloc() { return yloc; }
    public double getZloc() { return zloc; }

    @Override
    public String toString() {
        return "MaskCoordinate[" + segmentationKey() + ", trace_id=" + traceId
                + ", xloc=" + xloc + ", yloc=" + yloc + ", zloc=" + zloc + "]";
    }
}
