package io.github.jakubt4.anor.service.calibration;

import io.github.jakubt4.anor.model.ImageFrame;

/**
 * One independently failable calibration substep. Implementations return a new frame and
 * leave the input untouched; any runtime exception marks the step as skipped for that frame.
 */
public interface CalibrationStep {

    String name();

    ImageFrame apply(ImageFrame frame);
}
