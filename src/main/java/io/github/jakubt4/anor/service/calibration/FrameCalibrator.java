package io.github.jakubt4.anor.service.calibration;

import io.github.jakubt4.anor.model.ImageFrame;

import java.nio.file.Path;

/**
 * Turns one downloaded raw file into a calibrated {@link ImageFrame}.
 */
public interface FrameCalibrator {

    /**
     * Reads and calibrates the file. Calibration substeps that fail are skipped, so once the
     * file has been read a frame is always returned.
     *
     * @throws FrameUnreadableException if the file is not a readable image
     */
    ImageFrame calibrate(Path rawFile) throws FrameUnreadableException;
}
