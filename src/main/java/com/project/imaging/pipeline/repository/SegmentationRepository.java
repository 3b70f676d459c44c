package com.project.imaging.pipeline.repository;

import com.project.imaging.pipeline.model.Segmentation;
import com.project.imaging.pipeline.model.SegmentationKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface SegmentationRepository extends JpaRepository<Segmentation, SegmentationKey> {

    /** Segmentations whose mask coordinates have not been computed yet, in key order. */
    @Query("""
            select s from Segmentation s
            where not exists (
                select c from MaskCoordinate c
                where c.animalId = s.animalId and c.session = s.session and c.scanIdx = s.scanIdx
                  and c.extractMethod = s.extractMethod and c.slice = s.slice)
            order by s.animalId, s.session, s.scanIdx, s.extractMethod, s.slice
            """)
    List<Segmentation> findWithoutMaskCoordinates();
}
