package com.supermart.etl;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * SuperMart sales ETL: load, clean, enrich, measure quality, aggregate, summarize,
 * then write datasets, charts and the text report. Each stage takes a dataset and
 * returns a new one.
 */
public class SupermartPipeline {

    private static final Logger log = LoggerFactory.getLogger(SupermartPipeline.class);

    private final SparkSession spark;
    private final SourceLoader loader;
    private final DataCleaner dataCleaner;
    private final DataEnricher dataEnricher;
    private final QualityReporter qualityReporter;
    private final SalesAggregator aggregator;
    private final KpiSummarizer summarizer;
    private final SalesCharts charts;
    private final EtlReportWriter reportWriter;

    public SupermartPipeline(SparkSession spark) {
        this(spark, new EtlReportWriter());
    }

    public SupermartPipeline(SparkSession spark, EtlReportWriter reportWriter) {
        this.spark = spark;
        this.loader = new SourceLoader(spark);
        this.dataCleaner = new DataCleaner();
        this.dataEnricher = new DataEnricher();
        this.qualityReporter = new QualityReporter();
        this.aggregator = new SalesAggregator();
        this.summarizer = new KpiSummarizer();
        this.charts = new SalesCharts();
        this.reportWriter = reportWriter;
    }

    /**
     * Main pipeline execution method
     */
    public PipelineResult execute(PipelineConfig config) throws IOException {
        log.info("Starting SuperMart ETL pipeline ({})", config);

        // Step 1: Extraction
        log.info("Step 1: Loading sources from {}", config.getInputDir());
        LoadResult transactions = loader.loadTransactions(config.getTransactionsPath());
        LoadResult products = loader.loadProducts(config.getProductsPath());
        LoadResult stores = loader.loadStores(config.getStoresPath());
        List<LoadResult> loads = Arrays.asList(transactions, products, stores);

        // Steps 2-6: Transformation
        PipelineResult result = transform(transactions.getData(), products.getData(), stores.getData());

        // Step 7: Load
        log.info("Step 7: Writing outputs to {}", config.getOutputDir());
        List<Path> generated = writeOutputs(result, config);
        List<Path> manifest = new ArrayList<>(generated);
        manifest.add(config.getReportPath());

        PipelineResult completed = result.withRunOutputs(loads, manifest);
        reportWriter.write(config.getReportPath(), completed, charts.revenueByCity(result.getEnriched()), manifest);
        log.info("Generated {}", config.getReportPath());
        result.getEnriched().unpersist();

        log.info("Pipeline execution completed successfully!");
        return completed;
    }

    /**
     * Runs the in-memory stages (clean, enrich, quality, aggregate, summarize) without any I/O.
     * The enriched table of the result is left cached; {@link #execute} releases it after writing.
     */
    public PipelineResult transform(Dataset<Row> transactions, Dataset<Row> products, Dataset<Row> stores) {
        log.info("Step 2: Cleaning transactions");
        CleaningResult cleaned = dataCleaner.clean(transactions);

        log.info("Step 3: Enriching with product and store catalogs");
        Dataset<Row> enriched = dataEnricher.enrich(cleaned.getData(), products, stores);
        enriched.cache();

        log.info("Step 4: Computing quality counters");
        QualityReport quality = qualityReporter.report(enriched, cleaned.getDuplicatesRemoved());
        // enriched is materialized now
        cleaned.release();

        log.info("Step 5: Aggregating data mart");
        Dataset<Row> mart = aggregator.aggregate(enriched);

        log.info("Step 6: Summarizing KPIs");
        KpiSummary summary = summarizer.summarize(enriched);

        return new PipelineResult(Collections.emptyList(), enriched, mart, summary, quality, Collections.emptyList());
    }

    private List<Path> writeOutputs(PipelineResult result, PipelineConfig config) {
        List<Path> generated = new ArrayList<>();

        writeCsv(result.getEnriched(), config.getTransformedPath());
        generated.add(config.getTransformedPath());

        writeCsv(result.getMart(), config.getMartPath());
        generated.add(config.getMartPath());

        writeCsv(result.getSummary().toDataset(spark), config.getSummaryPath());
        generated.add(config.getSummaryPath());

        generated.addAll(charts.renderAll(result.getEnriched(), config.getChartsDir()));
        return generated;
    }

    private void writeCsv(Dataset<Row> data, Path target) {
        data.coalesce(1)
            .write()
            .mode("overwrite")
            .option("header", "true")
            .option("encoding", "UTF-8")
            .csv(target.toString());
        log.info("Generated {}", target);
    }
}
