package com.supermart.etl;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;

import java.util.Collections;
import java.util.List;

/**
 * Output of the cleaning stage: the deduplicated table plus the order ids that were dropped.
 */
public final class CleaningResult {

    private final Dataset<Row> data;
    private final List<Integer> droppedOrderIds;
    private final Dataset<Row> cached;

    public CleaningResult(Dataset<Row> data, List<Integer> droppedOrderIds) {
        this(data, droppedOrderIds, null);
    }

    CleaningResult(Dataset<Row> data, List<Integer> droppedOrderIds, Dataset<Row> cached) {
        this.data = data;
        this.droppedOrderIds = Collections.unmodifiableList(droppedOrderIds);
        this.cached = cached;
    }

    public Dataset<Row> getData() {
        return data;
    }

    /**
     * Key values of the removed rows, in input order. May contain nulls.
     */
    public List<Integer> getDroppedOrderIds() {
        return droppedOrderIds;
    }

    public int getDuplicatesRemoved() {
        return droppedOrderIds.size();
    }

    /**
     * Drops the cached intermediate behind {@link #getData()}. The table stays usable and is
     * recomputed on the next action.
     */
    public void release() {
        if (cached != null) {
            cached.unpersist();
        }
    }
}
