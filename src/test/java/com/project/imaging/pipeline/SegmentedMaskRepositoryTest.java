package com.project.imaging.pipeline;

import com.project.imaging.pipeline.model.MaskCoordinate;
import com.project.imaging.pipeline.model.Scan;
import com.project.imaging.pipeline.model.ScanKey;
import com.project.imaging.pipeline.model.ScanSession;
import com.project.imaging.pipeline.model.Segmentation;
import com.project.imaging.pipeline.model.SegmentationKey;
import com.project.imaging.pipeline.model.SegmentedMask;
import com.project.imaging.pipeline.repository.MaskCoordinateRepository;
import com.project.imaging.pipeline.repository.SegmentationRepository;
import com.project.imaging.pipeline.repository.SegmentedMaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DataJpaTest
class SegmentedMaskRepositoryTest {
    private static final ScanKey SCAN = new ScanKey(8623, 1, 3);
    private static final SegmentationKey SLICE_1 = new SegmentationKey(8623, 1, 3, 2, 1);
    private static final SegmentationKey SLICE_2 = new SegmentationKey(8623, 1, 3, 2, 2);

    @Autowired SegmentedMaskRepository masks;
    @Autowired SegmentationRepository segmentations;
    @Autowired MaskCoordinateRepository coordinates;
    @Autowired TestEntityManager entityManager;
    @Autowired JdbcTemplate jdbc;

    @BeforeEach
    void setup() {
        entityManager.persist(new ScanSession(8623, 1, "/mnt/scratch/2p/8623"));
        entityManager.persist(new Scan(SCAN, 210, "m8623A"));
        entityManager.persist(new Segmentation(SLICE_1));
        entityManager.persist(new Segmentation(SLICE_2));
        entityManager.persist(new SegmentedMask(SLICE_1, 2, new int[]{5, 6, 7}, new double[]{0.25, 1.5, 3}));
        entityManager.persist(new SegmentedMask(SLICE_1, 1, new int[]{1}, new double[]{1}));
        entityManager.persist(new SegmentedMask(SLICE_2, 1, new int[]{9}, new double[]{2}));
        entityManager.flush();
        entityManager.clear();
    }

    @Test
    void maskArrays_roundTripThroughJsonColumns() {
        List<SegmentedMask> rows = masks.findByKey(SLICE_1);

        assertThat(rows).extracting(SegmentedMask::getTraceId).containsExactly(1, 2);
        assertThat(rows.get(1).getMaskPixels()).containsExactly(5, 6, 7);
        assertThat(rows.get(1).getMaskWeights()).containsExactly(0.25, 1.5, 3.0);
        assertThat(jdbc.queryForObject(
                "select mask_pixels from segmented_mask where slice = 1 and trace_id = 2", String.class))
                .isEqualTo("[5,6,7]");
    }

    @Test
    void keySource_excludesSegmentationsWithCoordinates() {
        assertThat(segmentations.findWithoutMaskCoordinates())
                .extracting(Segmentation::key).containsExactly(SLICE_1, SLICE_2);

        entityManager.persist(new MaskCoordinate(SLICE_1, 1, 1.0, 2.0, 3.0));
        entityManager.flush();

        assertThat(segmentations.findWithoutMaskCoordinates())
                .extracting(Segmentation::key).containsExactly(SLICE_2);
    }

    @Test
    void deleteByKey_removesOnlyThatSlice() {
        entityManager.persist(new MaskCoordinate(SLICE_1, 1, 1.0, 2.0, 3.0));
        entityManager.persist(new MaskCoordinate(SLICE_1, 2, 1.0, 2.0, 3.0));
        entityManager.persist(new MaskCoordinate(SLICE_2, 1, 1.0, 2.0, 3.0));
        entityManager.flush();

        assertThat(coordinates.deleteByKey(SLICE_1)).isEqualTo(2);
        entityManager.flush();

        assertThat(coordinates.findByKey(SLICE_1)).isEmpty();
        assertThat(coordinates.findByKey(SLICE_2)).hasSize(1);
    }
}
