package com.supermart.etl;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything a run produced, handed from the transformation stages to the writers and tests.
 */
public final class PipelineResult {

    private final List<LoadResult> loads;
    private final Dataset<Row> enriched;
    private final Dataset<Row> mart;
    private final KpiSummary summary;
    private final QualityReport quality;
    private final List<Path> generatedFiles;

    public PipelineResult(List<LoadResult> loads, Dataset<Row> enriched, Dataset<Row> mart,
                          KpiSummary summary, QualityReport quality, List<Path> generatedFiles) {
        this.loads = List.copyOf(loads);
        this.enriched = enriched;
        this.mart = mart;
        this.summary = summary;
        this.quality = quality;
        this.generatedFiles = List.copyOf(generatedFiles);
    }

    PipelineResult withRunOutputs(List<LoadResult> runLoads, List<Path> files) {
        return new PipelineResult(runLoads, enriched, mart, summary, quality, files);
    }

    public List<LoadResult> getLoads() {
        return loads;
    }

    public Dataset<Row> getEnriched() {
        return enriched;
    }

    public Dataset<Row> getMart() {
        return mart;
    }

    public KpiSummary getSummary() {
        return summary;
    }

    public QualityReport getQuality() {
        return quality;
    }

    public List<Path> getGeneratedFiles() {
        return generatedFiles;
    }
}
