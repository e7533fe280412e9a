package com.supermart.etl;

import java.util.List;

/**
 * Raised when a many-to-one enrichment join finds a transaction key that matches
 * more than one catalog row.
 */
public class JoinCardinalityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String catalog;
    private final String keyColumn;
    private final List<String> duplicateKeys;

    public JoinCardinalityException(String catalog, String keyColumn, List<String> duplicateKeys) {
        super("Join with " + catalog + " on '" + keyColumn + "' is not many-to-one; keys with several matches: "
            + duplicateKeys);
        this.catalog = catalog;
        this.keyColumn = keyColumn;
        this.duplicateKeys = List.copyOf(duplicateKeys);
    }

    public String getCatalog() {
        return catalog;
    }

    public String getKeyColumn() {
        return keyColumn;
    }

    public List<String> getDuplicateKeys() {
        return duplicateKeys;
    }
}
