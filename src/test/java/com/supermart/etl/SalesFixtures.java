package com.supermart.etl;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructType;

import java.util.Arrays;

/**
 * Small in-memory catalogs and transaction tables shared by the stage tests.
 */
final class SalesFixtures {

    private SalesFixtures() {
    }

    static Row sale(Integer orderId, String productId, Integer quantity, Double unitPrice,
                    String customerId, String storeId, String date) {
        return RowFactory.create(orderId, productId, quantity, unitPrice, customerId, storeId, date);
    }

    static Dataset<Row> transactions(SparkSession spark, Row... rows) {
        return spark.createDataFrame(Arrays.asList(rows), SourceSchemas.transactionSchema());
    }

    static Dataset<Row> products(SparkSession spark) {
        StructType schema = new StructType()
            .add("producto_id", DataTypes.StringType)
            .add("nombre_producto", DataTypes.StringType)
            .add("categoria", DataTypes.StringType);
        return spark.createDataFrame(Arrays.asList(
            RowFactory.create("P001", "Leche entera", "Lácteos"),
            RowFactory.create("P002", "Gaseosa", "Bebidas"),
            RowFactory.create("P003", "Detergente", "Aseo")
        ), schema);
    }

    static Dataset<Row> stores(SparkSession spark) {
        StructType schema = new StructType()
            .add("tienda_id", DataTypes.StringType)
            .add("nombre_tienda", DataTypes.StringType)
            .add("ciudad", DataTypes.StringType)
            .add("region", DataTypes.StringType);
        return spark.createDataFrame(Arrays.asList(
            RowFactory.create("T01", "Centro", "Bogotá", "Andina"),
            RowFactory.create("T02", "Granada", "Cali", "Pacífica"),
            RowFactory.create("T03", "Prado", "Barranquilla", "Caribe")
        ), schema);
    }

    /**
     * Runs cleaning and enrichment over the given rows against the default catalogs.
     */
    static Dataset<Row> enriched(SparkSession spark, Row... rows) {
        CleaningResult cleaned = new DataCleaner().clean(transactions(spark, rows));
        return new DataEnricher().enrich(cleaned.getData(), products(spark), stores(spark));
    }

    static SparkSession localSession(String appName) {
        // Disable security for local testing (avoids Java 17+ Subject.getSubject() issues)
        System.setProperty("java.security.auth.login.config", "NONE");
        System.setProperty("hadoop.security.authentication", "simple");

        return SparkSession.builder()
            .appName(appName)
            .master("local[2]")
            .config("spark.driver.host", "localhost")
            .config("spark.driver.bindAddress", "127.0.0.1")
            .config("spark.hadoop.fs.defaultFS", "file:///")
            .config("spark.ui.enabled", "false")
            .getOrCreate();
    }
}
