package com.supermart.etl;

import org.apache.spark.sql.*;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static com.supermart.etl.SalesFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KpiSummarizer class
 */
public class KpiSummarizerTest {

    private static SparkSession spark;
    private KpiSummarizer summarizer;

    @BeforeAll
    public static void setUpSpark() {
        spark = localSession("KpiSummarizerTest");
    }

    @AfterAll
    public static void tearDownSpark() {
        if (spark != null) {
            spark.stop();
        }
    }

    @BeforeEach
    public void setUp() {
        summarizer = new KpiSummarizer();
    }

    @Test
    public void testSummarize_HeadlineMetrics() {
        Dataset<Row> enriched = enriched(spark,
            sale(1, "P001", 2, 10.0, "C1", "T01", "2024-03-18"),  // 20.00 Bogotá Lácteos
            sale(2, "P002", 1, 30.0, "C2", "T02", "2024-03-18"),  // 30.00 Cali Bebidas
            sale(3, "P002", 1, 15.0, null, "T02", "2024-03-19"),  // 15.00 Cali Bebidas
            sale(4, "P003", 1, 5.005, "C1", "T01", "2024-03-19")  // 5.00 (half-even) Bogotá Aseo
        );

        KpiSummary summary = summarizer.summarize(enriched);

        assertEquals(70.0, summary.getTotalRevenue(), 0.001);
        assertEquals(4, summary.getTransactionCount());
        assertEquals(17.5, summary.getAverageTicket(), 0.001);
        assertEquals(3, summary.getUniqueCustomers()); // C1, C2 and the sentinel
        assertEquals("Cali", summary.getTopCity());
        assertEquals("Bebidas", summary.getTopCategory());
    }

    @Test
    public void testSummarize_TiesGoToFirstKeyInOrder() {
        Dataset<Row> enriched = enriched(spark,
            sale(1, "P002", 1, 25.0, "C1", "T02", "2024-03-18"),  // Cali, Bebidas
            sale(2, "P001", 1, 25.0, "C1", "T01", "2024-03-18")   // Bogotá, Lácteos
        );

        KpiSummary summary = summarizer.summarize(enriched);

        assertEquals("Bogotá", summary.getTopCity());
        assertEquals("Bebidas", summary.getTopCategory());
    }

    @Test
    public void testSummarize_UnmatchedRowsIgnoredForTopPerformers() {
        Dataset<Row> enriched = enriched(spark,
            sale(1, "P999", 10, 100.0, "C1", "T99", "2024-03-18"),
            sale(2, "P003", 1, 1.0, "C1", "T03", "2024-03-18")
        );

        KpiSummary summary = summarizer.summarize(enriched);

        assertEquals("Barranquilla", summary.getTopCity());
        assertEquals("Aseo", summary.getTopCategory());
        assertEquals(1001.0, summary.getTotalRevenue(), 0.001);
    }

    @Test
    public void testSummarize_EmptyTable_DegenerateValues() {
        KpiSummary summary = summarizer.summarize(enriched(spark));

        assertEquals(0.0, summary.getTotalRevenue(), 0.0);
        assertEquals(0, summary.getTransactionCount());
        assertEquals(0.0, summary.getAverageTicket(), 0.0);
        assertEquals(0, summary.getUniqueCustomers());
        assertEquals(KpiSummary.NOT_AVAILABLE, summary.getTopCity());
        assertEquals(KpiSummary.NOT_AVAILABLE, summary.getTopCategory());
    }

    @Test
    public void testToDataset_SixMetricRows() {
        KpiSummary summary = new KpiSummary(1234.5, 10, 123.45, 7, "Bogotá", "Lácteos");

        List<Row> rows = summary.toDataset(spark).collectAsList();
        Map<String, String> metrics = summary.asMap();

        assertEquals(6, rows.size());
        assertEquals("ingresos_totales", rows.get(0).getAs("metrica"));
        assertEquals("1234.50", rows.get(0).getAs("valor"));
        assertEquals("Bogotá", metrics.get("ciudad_top"));
        assertEquals("Lácteos", metrics.get("categoria_top"));
    }
}
