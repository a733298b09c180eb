package io.github.jakubt4.anor.service.cache;

/**
 * A composite could not be persisted or removed.
 */
public class CacheWriteException extends RuntimeException {

    public CacheWriteException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
