package com.project.imaging.pipeline;

import com.project.imaging.pipeline.DTOs.Centroid;
import com.project.imaging.pipeline.DTOs.WeightedMask;
import com.project.imaging.pipeline.exceptions.CoordinateExtractionException;
import com.project.imaging.pipeline.service.CentroidCalculator;
import com.project.imaging.pipeline.service.SparseCentroidCalculator;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class SparseCentroidCalculatorTest {
    private final CentroidCalculator calculator = new SparseCentroidCalculator();

    /** Zero-based column-major index of pixel (x, y) in a frame with {@code h} rows. */
    private static int index(int x, int y, int h) {
        return x * h + y;
    }

    @Test
    void singlePixel_centroidIsPixelCenter() {
        // 10x8 frame, pixel (3, 5)
        WeightedMask mask = new WeightedMask(1, 10, 8, new int[]{index(3, 5, 8)}, new double[]{0.7});

        Centroid c = calculator.weightedCentroid(mask);

        assertThat(c.x()).isEqualTo(3.5);
        assertThat(c.y()).isEqualTo(5.5);
    }

    @Test
    void uniformWeights_centroidIsMeanPixelPosition() {
        int w = 20, h = 10;
        int[] pixels = {index(4, 2, h), index(5, 2, h), index(4, 3, h), index(11, 7, h)};
        double[] weights = new double[pixels.length];
        Arrays.fill(weights, 2.5);

        Centroid c = calculator.weightedCentroid(new WeightedMask(1, w, h, pixels, weights));

        double meanX = (4 + 5 + 4 + 11) / 4.0 + 0.5;
        double meanY = (2 + 2 + 3 + 7) / 4.0 + 0.5;
        assertThat(c.x()).isCloseTo(meanX, within(1e-12));
        assertThat(c.y()).isCloseTo(meanY, within(1e-12));
    }

    @Test
    void weightsPullCentroidTowardsHeavierPixel() {
        // 4x1 frame: pixels (0,0) weight 1 and (3,0) weight 3
        Centroid c = calculator.weightedCentroid(new WeightedMask(1, 4, 1, new int[]{0, 3}, new double[]{1, 3}));

        assertThat(c.x()).isCloseTo((0.5 * 1 + 3.5 * 3) / 4, within(1e-12));
        assertThat(c.y()).isEqualTo(0.5);
    }

    @Test
    void fullFrameUniformMask_centroidIsFrameCenter() {
        int w = 16, h = 12;
        int[] pixels = new int[w * h];
        double[] weights = new double[w * h];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = i;
            weights[i] = 1.0;
        }

        Centroid c = calculator.weightedCentroid(new WeightedMask(1, w, h, pixels, weights));

        assertThat(c.x()).isEqualTo(w / 2.0);
        assertThat(c.y()).isEqualTo(h / 2.0);
    }

    @Test
    void allZeroWeights_fails() {
        WeightedMask mask = new WeightedMask(9, 4, 4, new int[]{1, 2, 3}, new double[]{0, 0, 0});

        assertThatThrownBy(() -> calculator.weightedCentroid(mask))
                .isInstanceOf(CoordinateExtractionException.class)
                .hasMessageContaining("trace 9");
    }

    @Test
    void emptyMask_fails() {
        WeightedMask mask = new WeightedMask(3, 4, 4, new int[0], new double[0]);

        assertThatThrownBy(() -> calculator.weightedCentroid(mask))
                .isInstanceOf(CoordinateExtractionException.class);
    }
}
