package com.project.imaging.pipeline.service;

import java.util.List;

/**
 * A computed table: given an upstream key, produce the rows to insert for it.
 *
 * @param <K> key type of the upstream table the computation is keyed to
 * @param <R> row type of the computed table
 */
public interface AutoPopulate<K, R> {

    /** Name used in logs and reports. */
    String tableName();

    /** Upstream keys that have no rows in this table yet. */
    List<K> keySource();

    /**
     * Computes all rows for {@code key}. Must not write; a failure leaves nothing behind.
     */
    List<R> makeTuples(K key);

    void insert(List<R> rows);

    /** Removes the rows computed for {@code key}, returning how many were removed. */
    long deleteKey(K key);
}
