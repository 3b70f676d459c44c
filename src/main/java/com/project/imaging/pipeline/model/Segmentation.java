package com.project.imaging.pipeline.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

/**
 * A finished segmentation of one slice (upstream, read-only). Its rows are the key source of
 * the mask coordinate table.
 */
@Entity
@Table(name = "segmentation")
@IdClass(SegmentationKey.class)
public class Segmentation {

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

    protected Segmentation() {}

    public Segmentation(SegmentationKey key) {
        this.animalId = key.getAnimalId();
        this.session = key.getSession();
        this.scanIdx = key.getScanIdx();
        this.extractMethod = key.getExtractMethod();
        this.slice = key.getSlice();
    }

    public SegmentationKey key() {
        return new SegmentationKey(animalId, session, scanIdx, extractMethod, slice);
    }
}
