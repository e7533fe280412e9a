package com.supermart.etl;

import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.supermart.etl.SourceSchemas.*;
import static org.apache.spark.sql.functions.*;

/**
 * Computes the quality counters in a single aggregation pass.
 */
public class QualityReporter {

    private static final Logger log = LoggerFactory.getLogger(QualityReporter.class);

    public QualityReport report(Dataset<Row> enriched, long duplicatesRemoved) {
        Row counts = enriched.agg(
            count(lit(1)),
            countWhere(col(DATE).isNotNull()),
            countWhere(col(QUANTITY).gt(0)),
            countWhere(col(UNIT_PRICE).gt(0)),
            countWhere(col(CATEGORY).isNull()),
            countWhere(col(CITY).isNull())
        ).first();

        QualityReport report = new QualityReport(
            counts.getLong(0),
            duplicatesRemoved,
            counts.getLong(1),
            counts.getLong(2),
            counts.getLong(3),
            counts.getLong(4),
            counts.getLong(5)
        );
        log.info("Quality counters: {}", report);
        return report;
    }

    // null conditions count as false; coalesce keeps empty tables at 0
    private static Column countWhere(Column condition) {
        return coalesce(sum(when(condition, 1L).otherwise(0L)), lit(0L));
    }
}
