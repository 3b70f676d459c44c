package com.project.imaging.pipeline;

import com.project.imaging.pipeline.DTOs.PopulateReport;
import com.project.imaging.pipeline.config.PipelineProperties;
import com.project.imaging.pipeline.exceptions.CoordinateExtractionException;
import com.project.imaging.pipeline.service.AutoPopulate;
import com.project.imaging.pipeline.service.PopulateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PopulateServiceTest {

    @Mock PlatformTransactionManager transactionManager;

    private PopulateService service;

    @BeforeEach
    void setup() {
        when(transactionManager.getTransaction(any())).thenAnswer(inv -> new SimpleTransactionStatus());
        service = new PopulateService(transactionManager, new PipelineProperties(
                new PipelineProperties.Mask(1),
                new PipelineProperties.Populate(false, false),
                new PipelineProperties.Scans(null)));
    }

    /** Squares its keys; key 3 is broken. */
    static class SquaresTable implements AutoPopulate<Integer, Integer> {
        final List<Integer> pending = new ArrayList<>(List.of(1, 2, 3, 4));
        final List<Integer> stored = new ArrayList<>();

        @Override public String tableName() { return "squares"; }
        @Override public List<Integer> keySource() { return List.copyOf(pending); }

        @Override
        public List<Integer> makeTuples(Integer key) {
            if (key == 3) throw new CoordinateExtractionException("bad key " + key);
            return List.of(key * key);
        }

        @Override public void insert(List<Integer> rows) { stored.addAll(rows); }

        @Override
        public long deleteKey(Integer key) {
            return stored.remove(Integer.valueOf(key * key)) ? 1 : 0;
        }
    }

    @Test
    void populate_stopsAtFirstFailureByDefault() {
        SquaresTable table = new SquaresTable();

        assertThatThrownBy(() -> service.populate(table))
                .isInstanceOf(CoordinateExtractionException.class)
                .hasMessage("bad key 3");
        assertThat(table.stored).containsExactly(1, 4);
        verify(transactionManager, times(2)).commit(any());
        verify(transactionManager).rollback(any());
    }

    @Test
    void populate_suppressingErrors_reportsFailuresAndContinues() {
        SquaresTable table = new SquaresTable();

        PopulateReport report = service.populate(table, true);

        assertThat(table.stored).containsExactly(1, 4, 16);
        assertThat(report.table()).isEqualTo("squares");
        assertThat(report.populated()).isEqualTo(3);
        assertThat(report.failures()).singleElement()
                .satisfies(f -> {
                    assertThat(f.key()).isEqualTo("3");
                    assertThat(f.message()).isEqualTo("bad key 3");
                });
    }

    @Test
    void repopulate_replacesRowsOfKey() {
        SquaresTable table = new SquaresTable();
        table.stored.add(4);

        List<Integer> rows = service.repopulate(table, 2);

        assertThat(rows).containsExactly(4);
        assertThat(table.stored).containsExactly(4);
    }
}
