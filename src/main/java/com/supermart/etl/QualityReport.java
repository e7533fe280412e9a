package com.supermart.etl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed-shape set of data-quality counters over the enriched table.
 */
public final class QualityReport {

    public static final String TOTAL_RECORDS = "total_records";
    public static final String DUPLICATES_REMOVED = "duplicates_removed";
    public static final String VALID_DATES = "valid_dates";
    public static final String INVALID_DATES = "invalid_dates";
    public static final String POSITIVE_QUANTITY = "positive_quantity";
    public static final String POSITIVE_UNIT_PRICE = "positive_unit_price";
    public static final String UNMATCHED_PRODUCTS = "unmatched_products";
    public static final String UNMATCHED_STORES = "unmatched_stores";

    private final Map<String, Long> counters;

    QualityReport(long totalRecords, long duplicatesRemoved, long validDates, long positiveQuantity,
                  long positiveUnitPrice, long unmatchedProducts, long unmatchedStores) {
        Map<String, Long> values = new LinkedHashMap<>();
        values.put(TOTAL_RECORDS, totalRecords);
        values.put(DUPLICATES_REMOVED, duplicatesRemoved);
        values.put(VALID_DATES, validDates);
        values.put(INVALID_DATES, totalRecords - validDates);
        values.put(POSITIVE_QUANTITY, positiveQuantity);
        values.put(POSITIVE_UNIT_PRICE, positiveUnitPrice);
        values.put(UNMATCHED_PRODUCTS, unmatchedProducts);
        values.put(UNMATCHED_STORES, unmatchedStores);
        this.counters = Collections.unmodifiableMap(values);
    }

    public Map<String, Long> asMap() {
        return counters;
    }

    public long get(String counter) {
        Long value = counters.get(counter);
        if (value == null) {
            throw new IllegalArgumentException("Unknown quality counter: " + counter);
        }
        return value;
    }

    @Override
    public String toString() {
        return counters.toString();
    }
}
