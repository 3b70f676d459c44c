package com.project.imaging.pipeline.service;

import com.project.imaging.pipeline.DTOs.PopulateReport;
import com.project.imaging.pipeline.DTOs.PopulateReport.KeyFailure;
import com.project.imaging.pipeline.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs computed tables over their pending keys. Each key is computed and inserted in its own
 * transaction, so a failing key never leaves partial rows behind.
 */
@Service
public class PopulateService {
    private static final Logger log = LoggerFactory.getLogger(PopulateService.class);

    private final TransactionTemplate transactionTemplate;
    private final boolean suppressErrors;

    public PopulateService(PlatformTransactionManager transactionManager, PipelineProperties properties) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.suppressErrors = properties.populate().suppressErrors();
    }

    public <K, R> PopulateReport populate(AutoPopulate<K, R> table) {
        return populate(table, suppressErrors);
    }

    /**
     * @param suppressErrors when true, failing keys are logged and reported and the remaining
     *                       keys are still processed; otherwise the first failure is rethrown
     */
    public <K, R> PopulateReport populate(AutoPopulate<K, R> table, boolean suppressErrors) {
        List<K> keys = table.keySource();
        log.info("Populating {}: {} pending keys", table.tableName(), keys.size());

        int populated = 0;
        List<KeyFailure> failures = new ArrayList<>();
        for (K key : keys) {
            try {
                Integer rows = transactionTemplate.execute(status -> makeAndInsert(table, key).size());
                populated++;
                log.debug("Populated {} for {}: {} rows", table.tableName(), key, rows);
            } catch (RuntimeException e) {
                if (!suppressErrors) {
                    log.error("Populate of {} aborted at {}", table.tableName(), key, e);
                    throw e;
                }
                log.warn("Skipping {} in {}: {}", key, table.tableName(), e.getMessage());
                failures.add(new KeyFailure(String.valueOf(key), e.getMessage()));
            }
        }

        log.info("Populate of {} finished: {} populated, {} failed", table.tableName(), populated, failures.size());
        return new PopulateReport(table.tableName(), populated, List.copyOf(failures));
    }

    /** Deletes the rows of {@code key} and computes them again, atomically. */
    public <K, R> List<R> repopulate(AutoPopulate<K, R> table, K key) {
        return transactionTemplate.execute(status -> {
            long removed = table.deleteKey(key);
            List<R> rows = makeAndInsert(table, key);
            log.info("Repopulated {} for {}: {} rows removed, {} inserted", table.tableName(), key, removed, rows.size());
            return rows;
        });
    }

    private static <K, R> List<R> makeAndInsert(AutoPopulate<K, R> table, K key) {
        List<R> rows = table.makeTuples(key);
        table.insert(rows);
        return rows;
    }
}
