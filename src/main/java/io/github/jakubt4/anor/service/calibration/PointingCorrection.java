package io.github.jakubt4.anor.service.calibration;

import io.github.jakubt4.anor.model.ImageFrame;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Re-centres the grid so the reference pixel sits at the image centre, using an integer
 * roll of the samples. Stands in for a pointing-table update when none is available.
 */
@Order(1)
@Component
public class PointingCorrection implements CalibrationStep {

    @Override
    public String name() {
        return "pointing correction";
    }

    @Override
    public ImageFrame apply(final ImageFrame frame) {
        final var geometry = frame.geometry();
        if (!geometry.hasReferencePixel()) {
            throw new IllegalStateException("reference pixel (CRPIX1/CRPIX2) unavailable");
        }

        // FITS pixel centres are 1-based
        final var centerX = frame.width() / 2.0 + 0.5;
        final var centerY = frame.height() / 2.0 + 0.5;
        final var shiftX = (int) Math.round(centerX - geometry.referenceX());
        final var shiftY = (int) Math.round(centerY - geometry.referenceY());

        if (Math.abs(shiftX) >= frame.width() || Math.abs(shiftY) >= frame.height()) {
            throw new IllegalStateException("implausible reference pixel ("
                    + geometry.referenceX() + ", " + geometry.referenceY() + ")");
        }
        if (shiftX == 0 && shiftY == 0) {
            return frame;
        }

        return frame.withData(roll(frame.data(), shiftY, shiftX),
                geometry.withReferencePixel(geometry.referenceX() + shiftX, geometry.referenceY() + shiftY));
    }

    static float[][] roll(final float[][] data, final int shiftY, final int shiftX) {
        final var height = data.length;
        final var width = data[0].length;
        final var out = new float[height][width];
        for (int y = 0; y < height; y++) {
            final var targetY = Math.floorMod(y + shiftY, height);
            for (int x = 0; x < width; x++) {
                out[targetY][Math.floorMod(x + shiftX, width)] = data[y][x];
            }
        }
        return out;
    }
}
