package io.github.jakubt4.anor.service.calibration;

import io.github.jakubt4.anor.model.ImageFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads a FITS file and runs it through the ordered {@link CalibrationStep} chain
 * (pointing, registration, exposure normalisation). A failing step degrades the frame
 * instead of discarding it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StepwiseFrameCalibrator implements FrameCalibrator {

    private final FitsFrameReader fitsFrameReader;
    private final List<CalibrationStep> steps;

    @Override
    public ImageFrame calibrate(final Path rawFile) throws FrameUnreadableException {
        var frame = fitsFrameReader.read(rawFile);
        for (final var step : steps) {
            try {
                frame = step.apply(frame);
            } catch (final RuntimeException e) {
                log.warn("[CALIBRATE] {} skipped for {}: {}", step.name(), frame.origin(), e.getMessage());
            }
        }
        log.debug("[CALIBRATE] {} ready: {}x{}, exptime={}s, normalized={}",
                frame.origin(), frame.width(), frame.height(), frame.exposureSeconds(), frame.exposureNormalized());
        return frame;
    }
}
