package io.github.jakubt4.anor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Exposure-weighted combination of one or more {@link ImageFrame}s.
 *
 * <p>Treated as immutable once built; callers must not write into {@link #data()}.
 *
 * @param data          fused samples, same shape as every contributing frame
 * @param source        source identifier the frames were acquired from
 * @param band          band identifier
 * @param detector      detector code, {@code null} for imagers
 * @param frameCount    number of frames that contributed (at least one)
 * @param earliest      earliest contributing observation
 * @param latest        latest contributing observation
 * @param geometry      coordinate metadata of the reference frame
 * @param snrGain       signal-to-noise gain estimate, {@code null} when not computable
 */
public record CompositeImage(float[][] data,
                             String source,
                             int band,
                             String detector,
                             int frameCount,
                             Instant earliest,
                             Instant latest,
                             FrameGeometry geometry,
                             Double snrGain) {

    public CompositeImage {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(source, "source");
        if (frameCount < 1) {
            throw new IllegalArgumentException("Composite needs at least one frame, got " + frameCount);
        }
        if (data.length == 0 || data[0].length == 0) {
            throw new IllegalArgumentException("Composite grid must not be empty");
        }
        geometry = geometry == null ? FrameGeometry.unknown() : geometry;
    }

    public int height() {
        return data.length;
    }

    public int width() {
        return data[0].length;
    }
}
