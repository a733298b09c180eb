package io.github.jakubt4.anor.service.cache;

import io.github.jakubt4.anor.model.FrameGeometry;

import java.time.Instant;
import java.time.LocalDate;

/**
 * JSON sidecar stored next to each cached FITS grid.
 */
public record CacheEntryMetadata(String source,
                                 int band,
                                 LocalDate date,
                                 String detector,
                                 int frameCount,
                                 Instant earliest,
                                 Instant latest,
                                 Double snrGain,
                                 int width,
                                 int height,
                                 FrameGeometry geometry,
                                 Instant createdAt) {
}
