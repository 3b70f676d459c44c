package com.project.imaging.pipeline.repository;

import com.project.imaging.pipeline.model.MaskCoordinate;
import com.project.imaging.pipeline.model.SegmentationKey;
import com.project.imaging.pipeline.model.TraceKey;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface MaskCoordinateRepository extends JpaRepository<MaskCoordinate, TraceKey> {

    List<MaskCoordinate> findByAnimalIdAndSessionAndScanIdxAndExtractMethodAndSliceOrderByTraceId(
            int animalId, int session, int scanIdx, int extractMethod, int slice);

    long deleteByAnimalIdAndSessionAndScanIdxAndExtractMethodAndSlice(
            int animalId, int session, int scanIdx, int extractMethod, int slice);

    default List<MaskCoordinate> findByKey(SegmentationKey key) {
        return findByAnimalIdAndSessionAndScanIdxAndExtractMethodAndSliceOrderByTraceId(
                key.getAnimalId(), key.getSession(), key.getScanIdx(), key.getExtractMethod(), key.getSlice());
    }

    default long deleteByKey(SegmentationKey key) {
        return deleteByAnimalIdAndSessionAndScanIdxAndExtractMethodAndSlice(
                key.getAnimalId(), key.getSession(), key.getScanIdx(), key.getExtractMethod(), key.getSlice());
    }
}
