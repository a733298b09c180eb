package io.github.jakubt4.anor.model;

import java.time.LocalDate;

/**
 * Fully resolved (source, band, detector) for one acquisition attempt.
 */
public record AcquisitionTarget(ObservationSource source, int band, String detector) {

    public String sourceId() {
        return source.id();
    }

    public boolean isDetectorBand() {
        return source.bandKind() == ObservationSource.BandKind.DETECTOR;
    }

    public CacheKey cacheKey(final LocalDate date) {
        return new CacheKey(source.id(), band, date);
    }

    @Override
    public String toString() {
        return isDetectorBand()
                ? source.id() + "/" + detector
                : source.id() + "/" + band + "A";
    }
}
