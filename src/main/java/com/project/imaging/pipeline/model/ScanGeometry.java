package com.project.imaging.pipeline.model;

import com.project.imaging.pipeline.DTOs.FrameGeometry;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

/** Frame size of a prepared scan in pixels and micrometers (upstream, read-only). */
@Entity
@Table(name = "scan_geometry")
@IdClass(ScanKey.class)
public class ScanGeometry {

    @Id
    @Column(name = "animal_id")
    private int animalId;

    @Id
    @Column(name = "session")
    private int session;

    @Id
    @Column(name = "scan_idx")
    private int scanIdx;

    @Column(name = "px_width", nullable = false)
    private int pxWidth;

    @Column(name = "px_height", nullable = false)
    private int pxHeight;

    @Column(name = "um_width", nullable = false)
    private double umWidth;

    @Column(name = "um_height", nullable = false)
    private double umHeight;

    protected ScanGeometry() {}

    public ScanGeometry(ScanKey key, int pxWidth, int pxHeight, double umWidth, double umHeight) {
        this.animalId = key.getAnimalId();
        this.session = key.getSession();
        this.scanIdx = key.getScanIdx();
        this.pxWidth = pxWidth;
        this.pxHeight = pxHeight;
        this.umWidth = umWidth;
        this.umHeight = umHeight;
    }

    public FrameGeometry toFrameGeometry() {
        return new FrameGeometry(pxWidth, pxHeight, umWidth, umHeight);
    }

    public int getPxWidth() { return pxWidth; }
    public int getPxHeight() { return pxHeight; }
    public double getUmWidth() { return umWidth; }
    public double getUmHeight() { return umHeight; }
}
