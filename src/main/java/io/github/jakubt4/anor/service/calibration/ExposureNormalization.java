package io.github.jakubt4.anor.service.calibration;

import io.github.jakubt4.anor.model.ImageFrame;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Converts a frame to counts per second by dividing every sample by the exposure time.
 */
@Order(3)
@Component
public class ExposureNormalization implements CalibrationStep {

    @Override
    public String name() {
        return "exposure normalization";
    }

    @Override
    public ImageFrame apply(final ImageFrame frame) {
        if (frame.exposureNormalized()) {
            return frame;
        }
        final var exposure = frame.exposureSeconds();
        if (!(exposure > 0.0) || Double.isInfinite(exposure)) {
            throw new IllegalStateException("exposure time unavailable (EXPTIME=" + exposure + ")");
        }

        final var source = frame.data();
        final var out = new float[source.length][];
        for (int y = 0; y < source.length; y++) {
            out[y] = new float[source[y].length];
            for (int x = 0; x < source[y].length; x++) {
                out[y][x] = (float) (source[y][x] / exposure);
            }
        }
        return frame.normalized(out);
    }
}
