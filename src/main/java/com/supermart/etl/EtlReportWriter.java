package com.supermart.etl;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the plain-text run report: headline metrics, top performers, quality
 * counters, load statuses and the manifest of generated files.
 */
public class EtlReportWriter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "==========================================================";
    static final int TOP_CITIES = 3;

    private final Clock clock;

    public EtlReportWriter() {
        this(Clock.systemDefaultZone());
    }

    public EtlReportWriter(Clock clock) {
        this.clock = clock;
    }

    public Path write(Path reportFile, PipelineResult result, Map<String, Double> revenueByCity,
                      List<Path> manifest) throws IOException {
        if (reportFile.getParent() != null) {
            Files.createDirectories(reportFile.getParent());
        }
        Files.write(reportFile, render(result, revenueByCity, manifest).getBytes(StandardCharsets.UTF_8));
        return reportFile;
    }

    String render(PipelineResult result, Map<String, Double> revenueByCity, List<Path> manifest) {
        StringBuilder report = new StringBuilder();
        report.append(RULE).append('\n');
        report.append(" REPORTE ETL - SUPERMART COLOMBIA\n");
        report.append(" Generado: ").append(LocalDateTime.now(clock).format(TIMESTAMP)).append('\n');
        report.append(RULE).append("\n\n");

        report.append("FUENTES\n");
        for (LoadResult load : result.getLoads()) {
            report.append("  ").append(load.describe()).append('\n');
        }

        report.append("\nMETRICAS PRINCIPALES\n");
        for (Map.Entry<String, String> metric : result.getSummary().asMap().entrySet()) {
            report.append(String.format(Locale.ROOT, "  %-20s: %s\n", metric.getKey(), metric.getValue()));
        }

        report.append("\nTOP PERFORMERS\n");
        report.append("  Ciudad top    : ").append(result.getSummary().getTopCity()).append('\n');
        report.append("  Categoria top : ").append(result.getSummary().getTopCategory()).append('\n');
        report.append("  Top ").append(TOP_CITIES).append(" ciudades por ingresos:\n");
        Iterator<Map.Entry<String, Double>> cities = revenueByCity.entrySet().iterator();
        for (int rank = 1; rank <= TOP_CITIES && cities.hasNext(); rank++) {
            Map.Entry<String, Double> city = cities.next();
            report.append(String.format(Locale.ROOT, "    %d. %s - %.2f\n", rank, city.getKey(), city.getValue()));
        }

        report.append("\nCALIDAD DE DATOS\n");
        report.append("  ").append(result.getQuality().asMap()).append('\n');

        report.append("\nARCHIVOS GENERADOS\n");
        for (Path file : manifest) {
            report.append("  ").append(file).append('\n');
        }
        return report.toString();
    }
}
