package com.project.imaging.pipeline.model;

import java.io.Serializable;
import java.util.Objects;

/** Identifies one scan of a session; primary key of {@link Scan} and {@link ScanGeometry}. */
public class ScanKey implements Serializable {
    private int animalId;
    private int session;
    private int scanIdx;

    public ScanKey() {}

    public ScanKey(int animalId, int session, int scanIdx) {
        this.animalId = animalId;
        this.session = session;
        this.scanIdx = scanIdx;
    }

    public int getAnimalId() { return animalId; }
    public int getSession() { return session; }
    public int getScanIdx() { return scanIdx; }

    public SessionKey sessionKey() {
        return new SessionKey(animalId, session);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScanKey other)) return false;
        return animalId == other.animalId && session == other.session && scanIdx == other.scanIdx;
    }

    @Override
    public int hashCode() {
        return Objects.hash(animalId, session, scanIdx);
    }

    @Override
    public String toString() {
        return "animal_id=" + animalId + ", session=" + session + ", scan_idx=" + scanIdx;
    }
}
