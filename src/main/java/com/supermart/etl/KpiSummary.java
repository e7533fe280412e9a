package com.supermart.etl;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Headline business metrics of one run.
 */
public final class KpiSummary {

    public static final String METRIC = "metrica";
    public static final String VALUE = "valor";

    /** Placeholder for top performers when there is nothing to rank. */
    public static final String NOT_AVAILABLE = "N/A";

    private final double totalRevenue;
    private final long transactionCount;
    private final double averageTicket;
    private final long uniqueCustomers;
    private final String topCity;
    private final String topCategory;

    public KpiSummary(double totalRevenue, long transactionCount, double averageTicket,
                      long uniqueCustomers, String topCity, String topCategory) {
        this.totalRevenue = totalRevenue;
        this.transactionCount = transactionCount;
        this.averageTicket = averageTicket;
        this.uniqueCustomers = uniqueCustomers;
        this.topCity = topCity;
        this.topCategory = topCategory;
    }

    static KpiSummary empty() {
        return new KpiSummary(0.0, 0L, 0.0, 0L, NOT_AVAILABLE, NOT_AVAILABLE);
    }

    public double getTotalRevenue() {
        return totalRevenue;
    }

    public long getTransactionCount() {
        return transactionCount;
    }

    public double getAverageTicket() {
        return averageTicket;
    }

    public long getUniqueCustomers() {
        return uniqueCustomers;
    }

    public String getTopCity() {
        return topCity;
    }

    public String getTopCategory() {
        return topCategory;
    }

    /**
     * Metric name to display value, in report order.
     */
    public Map<String, String> asMap() {
        Map<String, String> metrics = new LinkedHashMap<>();
        metrics.put("ingresos_totales", String.format(Locale.ROOT, "%.2f", totalRevenue));
        metrics.put("num_transacciones", String.valueOf(transactionCount));
        metrics.put("ticket_promedio", String.format(Locale.ROOT, "%.2f", averageTicket));
        metrics.put("clientes_unicos", String.valueOf(uniqueCustomers));
        metrics.put("ciudad_top", topCity);
        metrics.put("categoria_top", topCategory);
        return metrics;
    }

    public Dataset<Row> toDataset(SparkSession spark) {
        StructType schema = new StructType()
            .add(METRIC, DataTypes.StringType, false)
            .add(VALUE, DataTypes.StringType, true);
        List<Row> rows = new ArrayList<>();
        for (Map.Entry<String, String> metric : asMap().entrySet()) {
            rows.add(RowFactory.create(metric.getKey(), metric.getValue()));
        }
        return spark.createDataFrame(rows, schema);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
