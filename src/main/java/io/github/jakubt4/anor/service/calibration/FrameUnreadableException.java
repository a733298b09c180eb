package io.github.jakubt4.anor.service.calibration;

/**
 * A raw archive file could not be parsed as an image. Fatal for that file only.
 */
public class FrameUnreadableException extends Exception {

    public FrameUnreadableException(final String message) {
        super(message);
    }

    public FrameUnreadableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
