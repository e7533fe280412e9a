package com.supermart.etl;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Input and output locations of a pipeline run. File names are fixed; only the two
 * directories can be overridden.
 */
public final class PipelineConfig {

    public static final String DEFAULT_INPUT_DIR = "data";
    public static final String DEFAULT_OUTPUT_DIR = "output";

    public static final String TRANSACTIONS_FILE = "ventas_crudas.csv";
    public static final String PRODUCTS_FILE = "productos.csv";
    public static final String STORES_FILE = "tiendas.csv";

    public static final String TRANSFORMED_DIR = "ventas_transformadas";
    public static final String MART_DIR = "data_mart_ventas";
    public static final String SUMMARY_DIR = "resumen_kpis";
    public static final String CHARTS_DIR = "graficos";
    public static final String REPORT_FILE = "reporte_etl.txt";

    private final Path inputDir;
    private final Path outputDir;

    public PipelineConfig(String inputDir, String outputDir) {
        this.inputDir = Paths.get(inputDir);
        this.outputDir = Paths.get(outputDir);
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(DEFAULT_INPUT_DIR, DEFAULT_OUTPUT_DIR);
    }

    /**
     * Optional positional arguments: {@code [input_dir] [output_dir]}.
     */
    public static PipelineConfig fromArgs(String[] args) {
        String input = args.length > 0 ? args[0] : DEFAULT_INPUT_DIR;
        String output = args.length > 1 ? args[1] : DEFAULT_OUTPUT_DIR;
        return new PipelineConfig(input, output);
    }

    public Path getInputDir() {
        return inputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public String getTransactionsPath() {
        return inputDir.resolve(TRANSACTIONS_FILE).toString();
    }

    public String getProductsPath() {
        return inputDir.resolve(PRODUCTS_FILE).toString();
    }

    public String getStoresPath() {
        return inputDir.resolve(STORES_FILE).toString();
    }

    public Path getTransformedPath() {
        return outputDir.resolve(TRANSFORMED_DIR);
    }

    public Path getMartPath() {
        return outputDir.resolve(MART_DIR);
    }

    public Path getSummaryPath() {
        return outputDir.resolve(SUMMARY_DIR);
    }

    public Path getChartsDir() {
        return outputDir.resolve(CHARTS_DIR);
    }

    public Path getReportPath() {
        return outputDir.resolve(REPORT_FILE);
    }

    @Override
    public String toString() {
        return "PipelineConfig{input=" + inputDir + ", output=" + outputDir + "}";
    }
}
