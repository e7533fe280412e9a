package com.supermart.etl;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.supermart.etl.SourceSchemas.*;
import static org.apache.spark.sql.functions.*;

/**
 * Computes the headline metrics over the enriched table. An empty table yields
 * {@link KpiSummary#empty()} rather than an error.
 */
public class KpiSummarizer {

    private static final Logger log = LoggerFactory.getLogger(KpiSummarizer.class);

    private static final String REVENUE = "_revenue";

    public KpiSummary summarize(Dataset<Row> enriched) {
        Row totals = enriched.agg(
            count(lit(1)),
            bround(coalesce(sum(col(TOTAL_AMOUNT)), lit(0.0)), 2),
            countDistinct(col(ORDER_ID)),
            bround(coalesce(avg(col(TOTAL_AMOUNT)), lit(0.0)), 2),
            countDistinct(col(CUSTOMER_ID))
        ).first();

        if (totals.getLong(0) == 0L) {
            log.warn("Enriched table is empty; summary holds degenerate values");
            return KpiSummary.empty();
        }

        KpiSummary summary = new KpiSummary(
            totals.getDouble(1),
            totals.getLong(2),
            totals.getDouble(3),
            totals.getLong(4),
            topByRevenue(enriched, CITY),
            topByRevenue(enriched, CATEGORY)
        );
        log.info("Summary: {}", summary);
        return summary;
    }

    /**
     * Key with the largest summed amount. Null keys are ignored; ties go to the
     * smallest key.
     */
    String topByRevenue(Dataset<Row> enriched, String key) {
        List<Row> top = enriched
            .filter(col(key).isNotNull())
            .groupBy(col(key))
            .agg(coalesce(sum(col(TOTAL_AMOUNT)), lit(0.0)).alias(REVENUE))
            .orderBy(col(REVENUE).desc(), col(key).asc())
            .limit(1)
            .collectAsList();
        return top.isEmpty() ? KpiSummary.NOT_AVAILABLE : String.valueOf(top.get(0).get(0));
    }
}
