package io.github.jakubt4.anor.model;

import java.time.LocalDate;

/**
 * A data origin the archive can be queried for.
 *
 * @param id              identifier used in cache keys and responses (e.g. "SDO-AIA")
 * @param instrument      instrument name understood by the archive search (e.g. "AIA")
 * @param availableFrom   first date the source is considered to have usable data
 * @param bandKind        whether the band is a wavelength or a detector code
 * @param defaultBand     band used when the caller does not pin one
 * @param defaultDetector detector used when the caller does not pin one (detector sources only)
 * @param fallbackSource  id of the source to retry with when this one yields nothing, nullable
 * @param fallbackBand    band to request from the fallback source, nullable
 */
public record ObservationSource(String id,
                                String instrument,
                                LocalDate availableFrom,
                                BandKind bandKind,
                                int defaultBand,
                                String defaultDetector,
                                String fallbackSource,
                                Integer fallbackBand) {

    public enum BandKind {
        WAVELENGTH,
        DETECTOR
    }

    public boolean isAvailableOn(final LocalDate date) {
        return availableFrom == null || !date.isBefore(availableFrom);
    }

    public boolean hasFallback() {
        return fallbackSource != null && !fallbackSource.isBlank();
    }
}
