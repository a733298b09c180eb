package io.github.jakubt4.anor.service;

/**
 * Stages of one acquisition; {@link #DONE} and {@link #FAILED} are terminal.
 */
public enum AcquisitionState {
    CHECK_CACHE,
    SEARCH,
    DOWNLOAD,
    CALIBRATE_EACH,
    FUSE,
    CACHE_WRITE,
    DONE,
    FAILED
}
