package com.supermart.etl;

import org.apache.spark.api.java.JavaDoubleRDD;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scala.Tuple2;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.supermart.etl.SourceSchemas.*;
import static org.apache.spark.sql.functions.*;

/**
 * Collects the small series behind the four report charts and renders them.
 */
public class SalesCharts {

    private static final Logger log = LoggerFactory.getLogger(SalesCharts.class);

    public static final String REVENUE_BY_CITY = "ingresos_por_ciudad.png";
    public static final String CATEGORY_SHARE = "participacion_categoria.png";
    public static final String TRANSACTIONS_BY_WEEKDAY = "transacciones_por_dia.png";
    public static final String AMOUNT_DISTRIBUTION = "distribucion_montos.png";

    static final int HISTOGRAM_BUCKETS = 20;

    private static final String VALUE = "_value";

    private final ChartRenderer renderer;

    public SalesCharts() {
        this(new ChartRenderer());
    }

    public SalesCharts(ChartRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * Revenue per city, highest first. Rows without a city are left out.
     */
    public Map<String, Double> revenueByCity(Dataset<Row> enriched) {
        return revenueBy(enriched, CITY);
    }

    public Map<String, Double> revenueByCategory(Dataset<Row> enriched) {
        return revenueBy(enriched, CATEGORY);
    }

    /**
     * Transaction count per weekday, Monday to Sunday, including empty days.
     */
    public Map<String, Long> transactionsByWeekday(Dataset<Row> enriched) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String day : DataEnricher.WEEKDAY_NAMES) {
            counts.put(day, 0L);
        }
        List<Row> rows = enriched
            .filter(col(WEEKDAY).isNotNull())
            .groupBy(col(WEEKDAY))
            .agg(count(lit(1)).alias(VALUE))
            .collectAsList();
        for (Row row : rows) {
            counts.put(row.getString(0), row.getLong(1));
        }
        return counts;
    }

    /**
     * Evenly spaced histogram of the total amount. An empty table yields no buckets.
     */
    public Tuple2<double[], long[]> amountDistribution(Dataset<Row> enriched, int buckets) {
        JavaDoubleRDD amounts = enriched
            .select(col(TOTAL_AMOUNT))
            .na().drop()
            .toJavaRDD()
            .mapToDouble(row -> row.getDouble(0));
        if (amounts.isEmpty()) {
            return new Tuple2<>(new double[] {0.0}, new long[0]);
        }
        return amounts.histogram(buckets);
    }

    /**
     * Renders all four charts into {@code directory}. A chart that cannot be drawn is
     * logged and skipped; the paths of the charts written are returned.
     */
    public List<Path> renderAll(Dataset<Row> enriched, Path directory) {
        List<Path> written = new ArrayList<>();

        render(written, directory.resolve(REVENUE_BY_CITY), target ->
            renderer.renderBarChart("Ingresos por ciudad", "Ingresos", revenueByCity(enriched), target));
        render(written, directory.resolve(CATEGORY_SHARE), target ->
            renderer.renderPieChart("Participación de ingresos por categoría", revenueByCategory(enriched), target));
        render(written, directory.resolve(TRANSACTIONS_BY_WEEKDAY), target ->
            renderer.renderBarChart("Transacciones por día de la semana", "Transacciones",
                transactionsByWeekday(enriched), target));
        render(written, directory.resolve(AMOUNT_DISTRIBUTION), target -> {
            Tuple2<double[], long[]> histogram = amountDistribution(enriched, HISTOGRAM_BUCKETS);
            renderer.renderHistogram("Distribución del monto total", "Frecuencia",
                histogram._1(), histogram._2(), target);
        });

        return written;
    }

    private Map<String, Double> revenueBy(Dataset<Row> enriched, String key) {
        List<Row> rows = enriched
            .filter(col(key).isNotNull())
            .groupBy(col(key))
            .agg(coalesce(sum(col(TOTAL_AMOUNT)), lit(0.0)).alias(VALUE))
            .orderBy(col(VALUE).desc(), col(key).asc())
            .collectAsList();
        Map<String, Double> revenue = new LinkedHashMap<>();
        for (Row row : rows) {
            revenue.put(String.valueOf(row.get(0)), row.getDouble(1));
        }
        return revenue;
    }

    private void render(List<Path> written, Path target, ChartJob job) {
        try {
            job.render(target);
            written.add(target);
        } catch (IOException | RuntimeException | LinkageError | InternalError e) {
            // headless hosts without a font setup fail inside AWT text rendering
            log.warn("Skipping chart {}: {}", target.getFileName(), e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface ChartJob {
        void render(Path target) throws IOException;
    }
}
