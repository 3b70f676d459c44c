package com.project.imaging.pipeline.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

/** Experiment session (upstream, read-only). */
@Entity
@Table(name = "scan_session")
@IdClass(SessionKey.class)
public class ScanSession {

    @Id
    @Column(name = "animal_id")
    private int animalId;

    @Id
    @Column(name = "session")
    private int session;

    /** Directory holding the session's raw scan files. */
    @Column(name = "scan_path", nullable = false)
    private String scanPath;

    protected ScanSession() {}

    public ScanSession(int animalId, int session, String scanPath) {
        this.animalId = animalId;
        this.session = session;
        this.scanPath = scanPath;
    }

    public int getAnimalId() { return animalId; }
    public int getSession() { return session; }
    public String getScanPath() { return scanPath; }
}
