package com.supermart.etl;

import org.apache.spark.sql.types.DataType;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructType;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column names and schemas of the three input sources and the derived columns
 * appended by the pipeline.
 */
public final class SourceSchemas {

    // Transactions
    public static final String ORDER_ID = "order_id";
    public static final String PRODUCT_ID = "producto_id";
    public static final String QUANTITY = "cantidad";
    public static final String UNIT_PRICE = "precio_unitario";
    public static final String CUSTOMER_ID = "cliente_id";
    public static final String STORE_ID = "tienda_id";
    public static final String DATE = "fecha";

    // Catalogs
    public static final String CATEGORY = "categoria";
    public static final String CITY = "ciudad";
    public static final String REGION = "region";

    // Derived
    public static final String TOTAL_AMOUNT = "monto_total";
    public static final String SALE_SIZE = "categoria_venta";
    public static final String YEAR = "anio";
    public static final String MONTH = "mes";
    public static final String WEEKDAY = "dia_semana";

    public static final String UNKNOWN_CUSTOMER = "UNKNOWN_CUSTOMER";

    private static final Map<String, DataType> TRANSACTION_TYPES = new LinkedHashMap<>();
    static {
        TRANSACTION_TYPES.put(ORDER_ID, DataTypes.IntegerType);
        TRANSACTION_TYPES.put(PRODUCT_ID, DataTypes.StringType);
        TRANSACTION_TYPES.put(QUANTITY, DataTypes.IntegerType);
        TRANSACTION_TYPES.put(UNIT_PRICE, DataTypes.DoubleType);
        TRANSACTION_TYPES.put(CUSTOMER_ID, DataTypes.StringType);
        TRANSACTION_TYPES.put(STORE_ID, DataTypes.StringType);
        TRANSACTION_TYPES.put(DATE, DataTypes.StringType);
    }

    private SourceSchemas() {
    }

    /**
     * Column name to target type for the transactions source, in file order.
     */
    public static Map<String, DataType> transactionTypes() {
        return Collections.unmodifiableMap(TRANSACTION_TYPES);
    }

    public static StructType transactionSchema() {
        StructType schema = new StructType();
        for (Map.Entry<String, DataType> column : TRANSACTION_TYPES.entrySet()) {
            schema = schema.add(column.getKey(), column.getValue(), true);
        }
        return schema;
    }

    public static StructType productSchema() {
        return new StructType()
            .add(PRODUCT_ID, DataTypes.StringType, true)
            .add(CATEGORY, DataTypes.StringType, true);
    }

    public static StructType storeSchema() {
        return new StructType()
            .add(STORE_ID, DataTypes.StringType, true)
            .add(CITY, DataTypes.StringType, true)
            .add(REGION, DataTypes.StringType, true);
    }

    public static List<String> requiredColumns(Source source) {
        switch (source) {
            case TRANSACTIONS:
                return List.copyOf(TRANSACTION_TYPES.keySet());
            case PRODUCTS:
                return Arrays.asList(PRODUCT_ID, CATEGORY);
            case STORES:
                return Arrays.asList(STORE_ID, CITY, REGION);
            default:
                throw new IllegalArgumentException("Unknown source: " + source);
        }
    }

    /**
     * Minimal schema used for the empty table returned when a source fails to load.
     */
    public static StructType emptySchema(Source source) {
        switch (source) {
            case TRANSACTIONS:
                return transactionSchema();
            case PRODUCTS:
                return productSchema();
            case STORES:
                return storeSchema();
            default:
                throw new IllegalArgumentException("Unknown source: " + source);
        }
    }

    /**
     * The three input sources.
     */
    public enum Source {
        TRANSACTIONS("transactions"),
        PRODUCTS("products"),
        STORES("stores");

        private final String label;

        Source(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
