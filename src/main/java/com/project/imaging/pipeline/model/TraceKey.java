package com.project.imaging.pipeline.model;

import java.io.Serializable;
import java.util.Objects;

/** Segmentation key plus trace id; primary key of per-cell rows. */
public class TraceKey implements Serializable {
    private int animalId;
    private int session;
    private int scanIdx;
    private int extractMethod;
    private int slice;
    private int traceId;

    public TraceKey() {}

    public TraceKey(SegmentationKey key, int traceId) {
        this.animalId = key.getAnimalId();
        this.session = key.getSession();
        this.scanIdx = key.getScanIdx();
        this.extractMethod = key.getExtractMethod();
        this.slice = key.getSlice();
        this.traceId = traceId;
    }

    public SegmentationKey segmentationKey() {
        return new SegmentationKey(animalId, session, scanIdx, extractMethod, slice);
    }

    public int getTraceId() { return traceId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceKey other)) return false;
        return animalId == other.animalId && session == other.session && scanIdx == other.scanIdx
                && extractMethod == other.extractMethod && slice == other.slice && traceId == other.traceId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(animalId, session, scanIdx, extractMethod, slice, traceId);
    }

    @Override
    public String toString() {
        return segmentationKey() + ", trace_id=" + traceId;
    }
}
