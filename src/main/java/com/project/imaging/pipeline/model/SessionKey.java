package com.project.imaging.pipeline.model;

import java.io.Serializable;
import java.util.Objects;

public class SessionKey implements Serializable {
    private int animalId;
    private int session;

    public SessionKey() {}

    public SessionKey(int animalId, int session) {
        this.animalId = animalId;
        this.session = session;
    }

    public int getAnimalId() { return animalId; }
    public int getSession() { return session; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionKey other)) return false;
        return animalId == other.animalId && session == other.session;
    }

    @Override
    public int hashCode() {
        return Objects.hash(animalId, session);
    }

    @Override
    public String toString() {
        return "animal_id=" + animalId + ", session=" + session;
    }
}
