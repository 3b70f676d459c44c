package com.project.imaging.pipeline.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

/** One acquired scan (upstream, read-only). */
@Entity
@Table(name = "scan")
@IdClass(ScanKey.class)
public class Scan {

    @Id
    @Column(name = "animal_id")
    private int animalId;

    @Id
    @Column(name = "session")
    private int session;

    @Id
    @Column(name = "scan_idx")
    private int scanIdx;

    /** (um) offset of the scan plane below the tissue surface */
    @Column(name = "depth", nullable = false)
    private double depth;

    /** Raw file base name, without the ScanImage file counter and extension. */
    @Column(name = "filename", nullable = false)
    private String filename;

    protected Scan() {}

    public Scan(ScanKey key, double depth, String filename) {
        this.animalId = key.getAnimalId();
        this.session = key.getSession();
        this.scanIdx = key.getScanIdx();
        this.depth = depth;
        this.filename = filename;
    }

    public ScanKey key() {
        return new ScanKey(animalId, session, scanIdx);
    }

    public double getDepth() { return depth; }
    public String getFilename() { return filename; }
}
