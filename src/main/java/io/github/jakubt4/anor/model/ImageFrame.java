package io.github.jakubt4.anor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One calibrated observation: a float32 sample grid plus acquisition metadata.
 *
 * <p>Frames have value semantics. The {@code with*} methods return new instances and
 * calibration steps never write into the grid of the frame they were given.
 *
 * @param data               samples, indexed {@code [row][column]}
 * @param observedAt         acquisition instant (UTC)
 * @param exposureSeconds    exposure duration as read from the header, {@code 0} when unknown
 * @param instrument         instrument identifier from the header (e.g. "AIA_3")
 * @param band               wavelength in Ångström, or the detector number for coronagraphs
 * @param detector           detector code (e.g. "C2"), {@code null} for imagers
 * @param geometry           coordinate metadata
 * @param origin             file name the frame was read from
 * @param exposureNormalized whether {@link #data} is already divided by the exposure time
 */
public record ImageFrame(float[][] data,
                         Instant observedAt,
                         double exposureSeconds,
                         String instrument,
                         int band,
                         String detector,
                         FrameGeometry geometry,
                         String origin,
                         boolean exposureNormalized) {

    /** Lower bound applied to the exposure time whenever it is used as a fusion weight. */
    public static final double MIN_EXPOSURE_SECONDS = 1e-6;

    public ImageFrame {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(observedAt, "observedAt");
        if (data.length == 0 || data[0].length == 0) {
            throw new IllegalArgumentException("Frame grid must not be empty");
        }
        geometry = geometry == null ? FrameGeometry.unknown() : geometry;
    }

    public int height() {
        return data.length;
    }

    public int width() {
        return data[0].length;
    }

    public boolean sameShapeAs(final int otherHeight, final int otherWidth) {
        if (height() != otherHeight) {
            return false;
        }
        for (final float[] row : data) {
            if (row.length != otherWidth) {
                return false;
            }
        }
        return true;
    }

    public double fusionWeight() {
        return Math.max(exposureSeconds, MIN_EXPOSURE_SECONDS);
    }

    public ImageFrame withData(final float[][] newData, final FrameGeometry newGeometry) {
        return new ImageFrame(newData, observedAt, exposureSeconds, instrument, band, detector,
                newGeometry, origin, exposureNormalized);
    }

    public ImageFrame normalized(final float[][] newData) {
        return new ImageFrame(newData, observedAt, exposureSeconds, instrument, band, detector,
                geometry, origin, true);
    }
}
