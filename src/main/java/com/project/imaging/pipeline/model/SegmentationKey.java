package com.project.imaging.pipeline.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identifies the segmentation of one slice of a scan. This is the key the mask coordinate
 * table is populated by; {@code slice} is 1-based.
 */
public class SegmentationKey implements Serializable {
    private int animalId;
    private int session;
    private int scanIdx;
    private int extractMethod;
    private int slice;

    public SegmentationKey() {}

    public SegmentationKey(int animalId, int session, int scanIdx, int extractMethod, int slice) {
        this.animalId = animalId;
        this.session = session;
        this.scanIdx = scanIdx;
        this.extractMethod = extractMethod;
        this.slice = slice;
    }

    public int getAnimalId() { return animalId; }
    public int getSession() { return session; }
    public int getScanIdx() { return scanIdx; }
    public int getExtractMethod() { return extractMethod; }
    public int getSlice() { return slice; }

    public ScanKey scanKey() {
        return new ScanKey(animalId, session, scanIdx);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SegmentationKey other)) return false;
        return animalId == other.animalId && session == other.session && scanIdx == other.scanIdx
                && extractMethod == other.extractMethod && slice == other.slice;
    }

    @Override
    public int hashCode() {
        return Objects.hash(animalId, session, scanIdx, extractMethod, slice);
    }

    @Override
    public String toString() {
        return "animal_id=" + animalId + ", session=" + session + ", scan_idx=" + scanIdx
                + ", extract_method=" + extractMethod + ", slice=" + slice;
    }
}
