package com.supermart.etl;

import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the SuperMart ETL pipeline
 *
 * Usage:
 *   java -cp target/classes com.supermart.etl.Main [input_dir] [output_dir]
 *
 * Reads ventas_crudas.csv, productos.csv and tiendas.csv from input_dir (default: data)
 * and writes every artifact under output_dir (default: output).
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        PipelineConfig config = PipelineConfig.fromArgs(args);
        System.setProperty("java.awt.headless", "true");

        log.info("Initializing Spark Session...");
        SparkSession spark = SparkSession.builder()
            .appName("SupermartEtl")
            .master("local[*]")
            .config("spark.sql.adaptive.enabled", "true")
            .config("spark.sql.adaptive.coalescePartitions.enabled", "true")
            .getOrCreate();

        int exitCode = 0;
        try {
            PipelineResult result = new SupermartPipeline(spark).execute(config);
            log.info("Pipeline completed: {} enriched rows, {} files generated",
                result.getQuality().get(QualityReport.TOTAL_RECORDS), result.getGeneratedFiles().size());
        } catch (Exception e) {
            log.error("Error executing pipeline: {}", e.getMessage(), e);
            exitCode = 1;
        } finally {
            spark.stop();
        }
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
}
