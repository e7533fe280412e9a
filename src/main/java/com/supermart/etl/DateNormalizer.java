package com.supermart.etl;

import org.apache.spark.sql.api.java.UDF1;
import org.apache.spark.sql.expressions.UserDefinedFunction;
import org.apache.spark.sql.types.DataTypes;

import java.io.Serializable;
import java.sql.Date;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.apache.spark.sql.functions.udf;

/**
 * Parses dates of unknown layout by trying an ordered list of strict patterns.
 * The first pattern that parses wins; when none does the date is undefined (null).
 */
public class DateNormalizer implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Year-month-day first, then day-month-year. */
    public static final List<String> DEFAULT_PATTERNS = Arrays.asList("uuuu-MM-dd", "dd-MM-uuuu");

    private final List<String> patterns;

    // DateTimeFormatter is not serializable; rebuilt on each executor
    private transient List<DateTimeFormatter> formatters;

    public DateNormalizer() {
        this(DEFAULT_PATTERNS);
    }

    public DateNormalizer(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("At least one date pattern is required");
        }
        this.patterns = new ArrayList<>(patterns);
    }

    public LocalDate parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        String trimmed = value.trim();
        for (DateTimeFormatter formatter : formatters()) {
            try {
                return LocalDate.parse(trimmed, formatter);
            } catch (DateTimeParseException e) {
                // next pattern
            }
        }
        return null;
    }

    public Date toSqlDate(String value) {
        LocalDate parsed = parse(value);
        return parsed == null ? null : Date.valueOf(parsed);
    }

    /**
     * Spark UDF mapping a string column to a date column.
     */
    public UserDefinedFunction asUdf() {
        return udf((UDF1<String, Date>) this::toSqlDate, DataTypes.DateType);
    }

    private List<DateTimeFormatter> formatters() {
        if (formatters == null) {
            List<DateTimeFormatter> built = new ArrayList<>();
            for (String pattern : patterns) {
                built.add(DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT));
            }
            formatters = built;
        }
        return formatters;
    }
}
