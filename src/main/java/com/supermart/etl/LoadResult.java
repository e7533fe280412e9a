package com.supermart.etl;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;

/**
 * A loaded source: the table (empty on failure), its status and a diagnostic message.
 */
public final class LoadResult {

    private final SourceSchemas.Source source;
    private final String path;
    private final Dataset<Row> data;
    private final LoadStatus status;
    private final String message;
    private final long rowCount;

    LoadResult(SourceSchemas.Source source, String path, Dataset<Row> data,
               LoadStatus status, String message, long rowCount) {
        this.source = source;
        this.path = path;
        this.data = data;
        this.status = status;
        this.message = message;
        this.rowCount = rowCount;
    }

    public SourceSchemas.Source getSource() {
        return source;
    }

    public String getPath() {
        return path;
    }

    public Dataset<Row> getData() {
        return data;
    }

    public LoadStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public long getRowCount() {
        return rowCount;
    }

    /**
     * One-line status as printed in the log and the text report.
     */
    public String describe() {
        String line = source.label() + ": " + rowCount + " rows [" + status + "]";
        return status.isOk() ? line : line + " " + message;
    }

    @Override
    public String toString() {
        return describe();
    }
}
