package com.supermart.etl;

import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.types.DataTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.supermart.etl.SourceSchemas.*;
import static org.apache.spark.sql.functions.*;

/**
 * Enrichment stage: derived amount and size bucket, catalog joins and calendar fields.
 */
public class DataEnricher {

    private static final Logger log = LoggerFactory.getLogger(DataEnricher.class);

    public static final String LOW = "Low";
    public static final String MEDIUM = "Medium";
    public static final String HIGH = "High";

    public static final double MEDIUM_LOWER_BOUND = 20.0;
    public static final double HIGH_LOWER_BOUND = 50.0;

    /** Index 0 is Monday. */
    public static final List<String> WEEKDAY_NAMES = Collections.unmodifiableList(Arrays.asList(
        "Lunes", "Martes", "Miércoles", "Jueves", "Viernes", "Sábado", "Domingo"
    ));

    private static final String ROW_INDEX = "_enrich_index";
    private static final String MATCHES = "_matches";
    private static final int MAX_REPORTED_KEYS = 10;

    public Dataset<Row> enrich(Dataset<Row> transactions, Dataset<Row> products, Dataset<Row> stores) {
        Dataset<Row> enriched = addTotalAmount(transactions);
        enriched = addSaleSize(enriched);
        enriched = enriched.withColumn(ROW_INDEX, monotonically_increasing_id());
        enriched = leftJoinManyToOne(enriched, products, PRODUCT_ID, "products", "_producto");
        enriched = leftJoinManyToOne(enriched, stores, STORE_ID, "stores", "_tienda");
        enriched = addCalendarFields(enriched);
        log.info("Enrichment done");
        return enriched.orderBy(col(ROW_INDEX)).drop(ROW_INDEX);
    }

    /**
     * quantity x unit price, rounded half-to-even to 2 decimals.
     */
    public Dataset<Row> addTotalAmount(Dataset<Row> df) {
        return df.withColumn(TOTAL_AMOUNT,
            bround(col(QUANTITY).cast(DataTypes.DoubleType).multiply(col(UNIT_PRICE)), 2));
    }

    /**
     * Low below 20, Medium from 20 up to 50, High from 50. Lower bounds are inclusive.
     */
    public Dataset<Row> addSaleSize(Dataset<Row> df) {
        Column amount = col(TOTAL_AMOUNT);
        return df.withColumn(SALE_SIZE,
            when(amount.lt(MEDIUM_LOWER_BOUND), lit(LOW))
                .when(amount.lt(HIGH_LOWER_BOUND), lit(MEDIUM))
                .when(amount.geq(HIGH_LOWER_BOUND), lit(HIGH))
        );
    }

    /**
     * Left join keeping every left row. A left key that matches more than one catalog
     * row is a contract violation. Catalog columns that already exist on the left are
     * suffixed instead of shadowed.
     */
    public Dataset<Row> leftJoinManyToOne(Dataset<Row> left, Dataset<Row> catalog, String key,
                                          String catalogName, String collisionSuffix) {
        Dataset<Row> right = catalog.withColumn(key, col(key).cast(DataTypes.StringType));
        List<String> leftColumns = Arrays.asList(left.columns());
        for (String column : right.columns()) {
            if (!column.equals(key) && leftColumns.contains(column)) {
                right = right.withColumnRenamed(column, column + collisionSuffix);
            }
        }

        List<String> duplicateKeys = new ArrayList<>();
        List<Row> violations = right
            .filter(col(key).isNotNull())
            .groupBy(col(key))
            .agg(count(lit(1)).alias(MATCHES))
            .filter(col(MATCHES).gt(1))
            .join(left.select(col(key)).distinct(), key)
            .orderBy(col(key))
            .limit(MAX_REPORTED_KEYS)
            .collectAsList();
        for (Row row : violations) {
            duplicateKeys.add(row.getString(0));
        }
        if (!duplicateKeys.isEmpty()) {
            throw new JoinCardinalityException(catalogName, key, duplicateKeys);
        }

        return left
            .join(right, left.col(key).equalTo(right.col(key)), "left")
            .drop(right.col(key));
    }

    /**
     * Year, month and weekday name from the normalized date; all null when the date is null.
     */
    public Dataset<Row> addCalendarFields(Dataset<Row> df) {
        Column[] names = new Column[WEEKDAY_NAMES.size()];
        for (int i = 0; i < names.length; i++) {
            names[i] = lit(WEEKDAY_NAMES.get(i));
        }
        // dayofweek is 1 = Sunday .. 7 = Saturday; shift to 0 = Monday
        Column mondayBased = pmod(dayofweek(col(DATE)).plus(5), lit(7));

        return df
            .withColumn(YEAR, year(col(DATE)))
            .withColumn(MONTH, month(col(DATE)))
            .withColumn(WEEKDAY, element_at(array(names), mondayBased.plus(1)));
    }
}
