package io.github.jakubt4.anor.service;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * What to acquire.
 *
 * @param date         observation day (UTC)
 * @param source       source id, or {@code null}/"auto" to pick one by date
 * @param band         wavelength or detector number; {@code null} uses the source default
 * @param detector     detector code for coronagraph sources, nullable
 * @param forceRefresh bypass the cache and query the archive again
 */
public record AcquisitionRequest(LocalDate date, String source, Integer band, String detector, boolean forceRefresh) {

    public static final String AUTO = "auto";

    public AcquisitionRequest {
        Objects.requireNonNull(date, "date");
    }

    public static AcquisitionRequest forDate(final LocalDate date) {
        return new AcquisitionRequest(date, null, null, null, false);
    }

    public boolean isAutoSource() {
        return source == null || source.isBlank() || AUTO.equals(source.toLowerCase(Locale.ROOT));
    }
}
