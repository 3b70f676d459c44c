package com.project.imaging.pipeline.repository;

import com.project.imaging.pipeline.model.SegmentationKey;
import com.project.imaging.pipeline.model.SegmentedMask;
import com.project.imaging.pipeline.model.TraceKey;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SegmentedMaskRepository extends JpaRepository<SegmentedMask, TraceKey> {

    List<SegmentedMask> findByAnimalIdAndSessionAndScanIdxAndExtractMethodAndSliceOrderByTraceId(
            int animalId, int session, int scanIdx, int extractMethod, int slice);

    default List<SegmentedMask> findByKey(SegmentationKey key) {
        return findByAnimalIdAndSessionAndScanIdxAndExtractMethodAndSliceOrderByTraceId(
                key.getAnimalId(), key.getSession(), key.getScanIdx(), key.getExtractMethod(), key.getSlice());
    }
}
