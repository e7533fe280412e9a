package com.supermart.etl;

import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.types.DataType;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructField;
import org.apache.spark.sql.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.apache.spark.sql.functions.*;

/**
 * Reads the delimited input sources. Every load is a single best-effort attempt:
 * failures come back as a {@link LoadStatus} with an empty table, never as an exception.
 * A file with malformed rows or values that do not fit their column type is rejected
 * as a whole with {@link LoadStatus#PARSE_ERROR}.
 */
public class SourceLoader {

    private static final Logger log = LoggerFactory.getLogger(SourceLoader.class);

    static final String CORRUPT_RECORD = "_corrupt_record";

    private static final String INTEGER_PATTERN = "^-?\\d+$";

    private final SparkSession spark;

    public SourceLoader(SparkSession spark) {
        this.spark = spark;
    }

    public LoadResult loadTransactions(String path) {
        return load(SourceSchemas.Source.TRANSACTIONS, path);
    }

    public LoadResult loadProducts(String path) {
        return load(SourceSchemas.Source.PRODUCTS, path);
    }

    public LoadResult loadStores(String path) {
        return load(SourceSchemas.Source.STORES, path);
    }

    public LoadResult load(SourceSchemas.Source source, String path) {
        LoadResult result = attemptLoad(source, path);
        if (result.getStatus().isOk()) {
            log.info("Loaded {}", result.describe());
        } else {
            log.warn("Could not load {} from {}: {}", source.label(), path, result.describe());
        }
        return result;
    }

    private LoadResult attemptLoad(SourceSchemas.Source source, String path) {
        if (path == null || !Files.exists(Paths.get(path))) {
            return failure(source, path, LoadStatus.FILE_NOT_FOUND, "file not found: " + path);
        }

        try {
            String[] header = spark.read()
                .option("header", "true")
                .option("inferSchema", "false")
                .csv(path)
                .columns();

            List<String> missing = new ArrayList<>(SourceSchemas.requiredColumns(source));
            missing.removeAll(Arrays.asList(header));
            if (!missing.isEmpty()) {
                return failure(source, path, LoadStatus.MISSING_COLUMNS, "missing required columns " + missing);
            }

            Dataset<Row> raw = readRaw(path, rawSchema(source, path, header));
            // Queries that touch the corrupt-record column need a cached relation
            raw.cache();
            try {
                List<String> problems = parseProblems(source, raw);
                if (!problems.isEmpty()) {
                    return failure(source, path, LoadStatus.PARSE_ERROR, String.join("; ", problems));
                }

                Dataset<Row> data = source == SourceSchemas.Source.TRANSACTIONS
                    ? typedTransactions(raw, header)
                    : keyedCatalog(source, raw);
                long rowCount = data.count();
                return new LoadResult(source, path, data, LoadStatus.OK, "OK", rowCount);
            } finally {
                raw.unpersist();
            }
        } catch (Exception e) {
            log.debug("Parse failure for {}", path, e);
            return failure(source, path, LoadStatus.PARSE_ERROR, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Transactions are read entirely as text so that type checks can see the raw values.
     * Catalogs keep their inferred types except for the key, which stays text so that
     * zero-padded ids survive.
     */
    private StructType rawSchema(SourceSchemas.Source source, String path, String[] header) {
        StructType schema = new StructType();
        if (source == SourceSchemas.Source.TRANSACTIONS) {
            for (String column : header) {
                schema = schema.add(column, DataTypes.StringType, true);
            }
        } else {
            String key = SourceSchemas.requiredColumns(source).get(0);
            StructType inferred = spark.read()
                .option("header", "true")
                .option("inferSchema", "true")
                .option("encoding", "UTF-8")
                .csv(path)
                .schema();
            for (StructField field : inferred.fields()) {
                DataType type = field.name().equals(key) ? DataTypes.StringType : field.dataType();
                schema = schema.add(field.name(), type, true);
            }
        }
        return schema.add(CORRUPT_RECORD, DataTypes.StringType, true);
    }

    private Dataset<Row> readRaw(String path, StructType schema) {
        return spark.read()
            .option("header", "true")
            .option("mode", "PERMISSIVE")
            .option("columnNameOfCorruptRecord", CORRUPT_RECORD)
            .option("encoding", "UTF-8")
            .schema(schema)
            .csv(path);
    }

    /**
     * Rows with the wrong number of fields, and for transactions any non-blank value that
     * does not fit its column type. Each problem names the first offending value.
     */
    private List<String> parseProblems(SourceSchemas.Source source, Dataset<Row> raw) {
        List<String> labels = new ArrayList<>();
        List<Column> checks = new ArrayList<>();

        Column malformed = col(CORRUPT_RECORD).isNotNull();
        labels.add("malformed rows");
        checks.add(countWhere(malformed));
        checks.add(first(col(CORRUPT_RECORD), true));

        if (source == SourceSchemas.Source.TRANSACTIONS) {
            for (Map.Entry<String, DataType> column : SourceSchemas.transactionTypes().entrySet()) {
                if (DataTypes.StringType.equals(column.getValue())) {
                    continue;
                }
                Column invalid = invalidValue(column.getKey(), column.getValue());
                labels.add("column " + column.getKey() + ": values that are not " + column.getValue().simpleString());
                checks.add(countWhere(invalid));
                checks.add(first(when(invalid, col(column.getKey())), true));
            }
        }

        Row found = raw.agg(checks.get(0), checks.subList(1, checks.size()).toArray(new Column[0])).first();

        List<String> problems = new ArrayList<>();
        for (int i = 0; i < labels.size(); i++) {
            long count = found.getLong(2 * i);
            if (count > 0) {
                problems.add(count + " " + labels.get(i) + " (first: '" + found.getString(2 * i + 1).trim() + "')");
            }
        }
        return problems;
    }

    // Blank means missing, not malformed. Integers must be plain digits so that 2.7 is not truncated to 2.
    private static Column invalidValue(String column, DataType type) {
        Column value = trim(col(column));
        Column present = value.isNotNull().and(value.notEqual(""));
        Column unparseable = DataTypes.IntegerType.equals(type)
            ? not(value.rlike(INTEGER_PATTERN)).or(value.cast(type).isNull())
            : value.cast(type).isNull();
        return present.and(unparseable);
    }

    private static Column countWhere(Column condition) {
        return coalesce(sum(when(condition, 1L).otherwise(0L)), lit(0L));
    }

    /**
     * Applies the fixed transaction types by header name. Extra columns are kept as text.
     */
    private Dataset<Row> typedTransactions(Dataset<Row> raw, String[] header) {
        Map<String, DataType> types = SourceSchemas.transactionTypes();
        List<Column> columns = new ArrayList<>();
        for (String column : types.keySet()) {
            columns.add(trim(col(column)).cast(types.get(column)).alias(column));
        }
        for (String column : header) {
            if (!types.containsKey(column)) {
                columns.add(col(column));
            }
        }
        return raw.select(columns.toArray(new Column[0]));
    }

    private Dataset<Row> keyedCatalog(SourceSchemas.Source source, Dataset<Row> raw) {
        String key = SourceSchemas.requiredColumns(source).get(0);
        return raw.drop(CORRUPT_RECORD).withColumn(key, trim(col(key)));
    }

    private LoadResult failure(SourceSchemas.Source source, String path, LoadStatus status, String message) {
        Dataset<Row> empty = spark.createDataFrame(new ArrayList<Row>(), SourceSchemas.emptySchema(source));
        return new LoadResult(source, path, empty, status, message, 0L);
    }
}
