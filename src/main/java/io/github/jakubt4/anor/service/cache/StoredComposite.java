package io.github.jakubt4.anor.service.cache;

import io.github.jakubt4.anor.model.CompositeImage;

import java.time.Instant;

/**
 * A cached composite together with the time it was written to disk.
 */
public record StoredComposite(CompositeImage composite, Instant createdAt) {
}
