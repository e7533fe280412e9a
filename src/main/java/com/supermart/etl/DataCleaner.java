package com.supermart.etl;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.expressions.Window;
import org.apache.spark.sql.expressions.WindowSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.supermart.etl.SourceSchemas.*;
import static org.apache.spark.sql.functions.*;

/**
 * Cleaning stage: date normalization, customer null-fill and order deduplication.
 */
public class DataCleaner {

    private static final Logger log = LoggerFactory.getLogger(DataCleaner.class);

    static final String ROW_INDEX = "_row_index";
    private static final String OCCURRENCE = "_occurrence";

    private final DateNormalizer dateNormalizer;

    public DataCleaner() {
        this(new DateNormalizer());
    }

    public DataCleaner(DateNormalizer dateNormalizer) {
        this.dateNormalizer = dateNormalizer;
    }

    /**
     * Runs the three cleaning steps in order and returns the deduplicated table.
     */
    public CleaningResult clean(Dataset<Row> transactions) {
        Dataset<Row> cleaned = normalizeDates(transactions);
        cleaned = fillMissingCustomers(cleaned);
        CleaningResult result = deduplicate(cleaned);
        log.info("Cleaning done: {} duplicate orders removed", result.getDuplicatesRemoved());
        return result;
    }

    /**
     * Replace the raw date text with a calendar date; unparseable values become null.
     */
    public Dataset<Row> normalizeDates(Dataset<Row> df) {
        return df.withColumn(DATE, dateNormalizer.asUdf().apply(col(DATE).cast("string")));
    }

    /**
     * Fill missing or blank customer ids with the sentinel.
     */
    public Dataset<Row> fillMissingCustomers(Dataset<Row> df) {
        return df.withColumn(CUSTOMER_ID,
            when(col(CUSTOMER_ID).isNull().or(trim(col(CUSTOMER_ID)).equalTo("")), lit(UNKNOWN_CUSTOMER))
                .otherwise(col(CUSTOMER_ID))
        );
    }

    /**
     * Keep the first occurrence of each order id by input position. Null ids count as one key.
     * The ranked intermediate stays cached until {@link CleaningResult#release()}.
     */
    public CleaningResult deduplicate(Dataset<Row> df) {
        WindowSpec byOrder = Window.partitionBy(col(ORDER_ID)).orderBy(col(ROW_INDEX));

        Dataset<Row> ranked = df
            .withColumn(ROW_INDEX, monotonically_increasing_id())
            .withColumn(OCCURRENCE, row_number().over(byOrder));
        ranked.cache();

        List<Integer> dropped = new ArrayList<>();
        for (Row row : ranked.filter(col(OCCURRENCE).gt(1)).orderBy(col(ROW_INDEX)).select(ORDER_ID).collectAsList()) {
            dropped.add(row.isNullAt(0) ? null : row.getInt(0));
        }

        Dataset<Row> deduplicated = ranked
            .filter(col(OCCURRENCE).equalTo(1))
            .orderBy(col(ROW_INDEX))
            .drop(ROW_INDEX, OCCURRENCE);

        return new CleaningResult(deduplicated, dropped, ranked);
    }
}
