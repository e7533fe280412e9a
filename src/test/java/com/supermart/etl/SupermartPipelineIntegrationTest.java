package com.supermart.etl;

import org.apache.spark.sql.*;
import org.junit.jupiter.api.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import static org.apache.spark.sql.functions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the complete SupermartPipeline
 */
public class SupermartPipelineIntegrationTest {

    private static final int SAMPLE_RECORDS = 400;

    private static SparkSession spark;
    private SupermartPipeline pipeline;
    private Path testInputPath;
    private Path testOutputPath;

    @BeforeAll
    public static void setUpSpark() {
        spark = SalesFixtures.localSession("SupermartPipelineIntegrationTest");
    }

    @AfterAll
    public static void tearDownSpark() {
        if (spark != null) {
            spark.stop();
        }
    }

    @BeforeEach
    public void setUp() throws Exception {
        pipeline = new SupermartPipeline(spark);
        testInputPath = Paths.get("test_input_" + System.currentTimeMillis());
        testOutputPath = Paths.get("test_output_" + System.currentTimeMillis());

        new SampleDataGenerator(42).generate(SAMPLE_RECORDS, testInputPath);
    }

    @AfterEach
    public void tearDown() throws Exception {
        deleteRecursively(testInputPath);
        deleteRecursively(testOutputPath);
    }

    private void deleteRecursively(Path root) throws Exception {
        if (Files.exists(root)) {
            Files.walk(root)
                .sorted((a, b) -> -a.compareTo(b))
                .forEach(path -> path.toFile().delete());
        }
    }

    private PipelineConfig config() {
        return new PipelineConfig(testInputPath.toString(), testOutputPath.toString());
    }

    @Test
    public void testFullPipeline_GeneratesAllOutputDatasets() throws Exception {
        PipelineResult result = pipeline.execute(config());

        for (String dir : new String[] {PipelineConfig.TRANSFORMED_DIR, PipelineConfig.MART_DIR, PipelineConfig.SUMMARY_DIR}) {
            File outputDir = testOutputPath.resolve(dir).toFile();
            assertTrue(outputDir.exists(), dir + " directory should exist");
            File[] csvFiles = outputDir.listFiles((d, name) -> name.endsWith(".csv"));
            assertNotNull(csvFiles);
            assertTrue(csvFiles.length > 0, dir + " should contain CSV files");
        }
        assertTrue(Files.exists(testOutputPath.resolve(PipelineConfig.REPORT_FILE)));
        assertTrue(result.getGeneratedFiles().contains(config().getReportPath()));
        result.getLoads().forEach(load -> assertEquals(LoadStatus.OK, load.getStatus()));
    }

    @Test
    public void testFullPipeline_InvariantsOnGeneratedData() throws Exception {
        PipelineResult result = pipeline.execute(config());
        Dataset<Row> enriched = result.getEnriched();
        QualityReport quality = result.getQuality();

        long rows = enriched.count();
        assertEquals(SAMPLE_RECORDS - quality.get(QualityReport.DUPLICATES_REMOVED), rows);
        assertEquals(rows, enriched.select("order_id").distinct().count());
        assertEquals(rows, result.getMart().agg(sum("num_transacciones")).first().getLong(0));

        assertTrue(quality.get(QualityReport.DUPLICATES_REMOVED) > 0);
        assertTrue(quality.get(QualityReport.INVALID_DATES) > 0);
        assertTrue(quality.get(QualityReport.UNMATCHED_PRODUCTS) > 0);
        assertEquals(rows, quality.get(QualityReport.VALID_DATES) + quality.get(QualityReport.INVALID_DATES));

        assertEquals(0, enriched.filter(col("monto_total").lt(0)).count());
        assertEquals(0, enriched.filter(col("monto_total").isNotNull().and(col("categoria_venta").isNull())).count());
        assertEquals(0, enriched.filter(col("fecha").isNull().and(col("anio").isNotNull())).count());
        assertEquals(0, enriched.filter(col("categoria").isNull()
            .and(col("producto_id").notEqual(SampleDataGenerator.UNKNOWN_PRODUCT))).count());
        assertEquals(0, enriched.filter(col("cliente_id").isNull()).count());
    }

    @Test
    public void testFullPipeline_TransformedDatasetReadable() throws Exception {
        PipelineResult result = pipeline.execute(config());

        Dataset<Row> transformed = spark.read()
            .option("header", "true")
            .csv(testOutputPath.resolve(PipelineConfig.TRANSFORMED_DIR).toString());

        assertEquals(result.getEnriched().count(), transformed.count());
        assertTrue(Arrays.asList(transformed.columns()).containsAll(Arrays.asList(
            "monto_total", "categoria_venta", "anio", "mes", "dia_semana", "categoria", "ciudad", "region")));
    }

    @Test
    public void testFullPipeline_SummaryAndReport() throws Exception {
        PipelineResult result = pipeline.execute(config());

        Dataset<Row> summary = spark.read()
            .option("header", "true")
            .csv(testOutputPath.resolve(PipelineConfig.SUMMARY_DIR).toString());
        assertEquals(6, summary.count());
        assertEquals(1, summary.filter(col("metrica").equalTo("ciudad_top")
            .and(col("valor").equalTo(result.getSummary().getTopCity()))).count());

        String report = new String(Files.readAllBytes(testOutputPath.resolve(PipelineConfig.REPORT_FILE)),
            StandardCharsets.UTF_8);
        assertTrue(report.contains("REPORTE ETL"));
        assertTrue(report.contains(result.getQuality().asMap().toString()));
        assertTrue(report.contains(result.getSummary().getTopCategory()));
        assertTrue(report.contains(PipelineConfig.MART_DIR));
    }
}
