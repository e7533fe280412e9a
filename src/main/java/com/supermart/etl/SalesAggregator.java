package com.supermart.etl;

import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.types.DataTypes;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.supermart.etl.SourceSchemas.*;
import static org.apache.spark.sql.functions.*;

/**
 * Builds the sales data mart: one row per (date, year, month, weekday, city, region, category).
 */
public class SalesAggregator {

    public static final String TRANSACTION_COUNT = "num_transacciones";
    public static final String UNITS_SOLD = "unidades_vendidas";
    public static final String REVENUE = "ingresos_totales";

    public static final List<String> GROUP_KEYS = Collections.unmodifiableList(Arrays.asList(
        DATE, YEAR, MONTH, WEEKDAY, CITY, REGION, CATEGORY
    ));

    /**
     * Null key components form their own groups. Rows come back sorted by the keys.
     */
    public Dataset<Row> aggregate(Dataset<Row> enriched) {
        Column[] keys = GROUP_KEYS.stream().map(k -> col(k)).toArray(Column[]::new);
        Column[] ordering = GROUP_KEYS.stream().map(k -> col(k).asc_nulls_first()).toArray(Column[]::new);

        return enriched
            .groupBy(keys)
            .agg(
                count(lit(1)).alias(TRANSACTION_COUNT),
                coalesce(sum(col(QUANTITY)), lit(0L)).alias(UNITS_SOLD),
                bround(coalesce(sum(col(TOTAL_AMOUNT)), lit(0.0)), 2).cast(DataTypes.DoubleType).alias(REVENUE)
            )
            .orderBy(ordering);
    }
}
