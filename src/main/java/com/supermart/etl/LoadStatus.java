package com.supermart.etl;

/**
 * Outcome of loading one input source.
 */
public enum LoadStatus {
    OK,
    FILE_NOT_FOUND,
    MISSING_COLUMNS,
    PARSE_ERROR;

    public boolean isOk() {
        return this == OK;
    }
}
