package io.github.jakubt4.anor.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Time range the archive is searched in. Only lives for the duration of one acquisition.
 */
public record SearchWindow(Instant start, Instant end) {

    public SearchWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Search window must satisfy start < end: " + start + " .. " + end);
        }
    }

    public static SearchWindow around(final Instant center, final Duration halfWidth) {
        return new SearchWindow(center.minus(halfWidth), center.plus(halfWidth));
    }

    /**
     * Builds the widening cascade, one window per half width, in the order given.
     */
    public static List<SearchWindow> cascade(final Instant center, final List<Duration> halfWidths) {
        return halfWidths.stream()
                .map(halfWidth -> around(center, halfWidth))
                .toList();
    }

    public Duration span() {
        return Duration.between(start, end);
    }
}
