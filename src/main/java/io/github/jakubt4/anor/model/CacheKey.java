package io.github.jakubt4.anor.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identity of one cached composite: (source, band, calendar day).
 */
public record CacheKey(String source, int band, LocalDate date) {

    /** Source ids are used verbatim in file names. */
    public static final Pattern SOURCE_ID = Pattern.compile("[A-Za-z0-9-]+");

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    public CacheKey {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(date, "date");
        if (!SOURCE_ID.matcher(source).matches()) {
            throw new IllegalArgumentException("Source id '" + source + "' must match " + SOURCE_ID.pattern());
        }
    }

    /**
     * Filesystem-safe string form, e.g. {@code SDO-AIA_171_20240601}.
     */
    public String encode() {
        return source + "_" + band + "_" + date.format(DAY);
    }

    @Override
    public String toString() {
        return encode();
    }
}
