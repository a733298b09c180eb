package io.github.jakubt4.anor.service.calibration;

import io.github.jakubt4.anor.config.CalibrationProperties;
import io.github.jakubt4.anor.model.ImageFrame;
import lombok.RequiredArgsConstructor;
import org.hipparchus.util.FastMath;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Resamples a frame to the configured plate scale of its instrument and rotates it
 * north-up about the reference pixel. The output keeps the input shape; samples that map
 * outside the source grid are NaN.
 */
@Order(2)
@Component
@RequiredArgsConstructor
public class PlateScaleRegistration implements CalibrationStep {

    private static final double TOLERANCE = 1e-9;

    private final CalibrationProperties calibrationProperties;

    @Override
    public String name() {
        return "plate-scale registration";
    }

    @Override
    public ImageFrame apply(final ImageFrame frame) {
        final var geometry = frame.geometry();
        if (!geometry.hasPlateScale()) {
            throw new IllegalStateException("plate scale (CDELT1/CDELT2) unavailable");
        }

        final var nativeX = FastMath.abs(geometry.scaleX());
        final var nativeY = FastMath.abs(geometry.scaleY());
        final double target = calibrationProperties.plateScaleFor(frame.instrument()).orElse(nativeX);
        final var zoomX = target / nativeX;
        final var zoomY = target / nativeY;
        final var rotation = geometry.rotationOrZero();

        if (FastMath.abs(zoomX - 1.0) < TOLERANCE && FastMath.abs(zoomY - 1.0) < TOLERANCE
                && FastMath.abs(rotation) < TOLERANCE) {
            return frame.withData(frame.data(), geometry.registered(target));
        }

        final var width = frame.width();
        final var height = frame.height();
        final var centerX = geometry.hasReferencePixel() ? geometry.referenceX() - 1.0 : (width - 1) / 2.0;
        final var centerY = geometry.hasReferencePixel() ? geometry.referenceY() - 1.0 : (height - 1) / 2.0;
        final var theta = FastMath.toRadians(rotation);
        final var cos = FastMath.cos(theta);
        final var sin = FastMath.sin(theta);

        final var source = frame.data();
        final var out = new float[height][width];
        for (int y = 0; y < height; y++) {
            final var dy = (y - centerY) * zoomY;
            for (int x = 0; x < width; x++) {
                final var dx = (x - centerX) * zoomX;
                final var sourceX = centerX + cos * dx - sin * dy;
                final var sourceY = centerY + sin * dx + cos * dy;
                out[y][x] = bilinear(source, sourceX, sourceY);
            }
        }
        return frame.withData(out, geometry.registered(target));
    }

    static float bilinear(final float[][] data, final double x, final double y) {
        final var height = data.length;
        final var width = data[0].length;
        if (x < 0 || y < 0 || x > width - 1 || y > height - 1) {
            return Float.NaN;
        }
        final var x0 = (int) FastMath.floor(x);
        final var y0 = (int) FastMath.floor(y);
        final var x1 = Math.min(x0 + 1, width - 1);
        final var y1 = Math.min(y0 + 1, height - 1);
        final var fx = x - x0;
        final var fy = y - y0;

        final var top = data[y0][x0] * (1 - fx) + data[y0][x1] * fx;
        final var bottom = data[y1][x0] * (1 - fx) + data[y1][x1] * fx;
        return (float) (top * (1 - fy) + bottom * fy);
    }
}
