package io.github.jakubt4.anor.service;

import io.github.jakubt4.anor.model.CacheKey;
import io.github.jakubt4.anor.model.CompositeImage;

/**
 * Outcome of {@link AcquisitionOrchestrator#acquire}.
 *
 * @param state           terminal state, {@link AcquisitionState#DONE} or {@link AcquisitionState#FAILED}
 * @param key             cache key of the request as resolved
 * @param composite       the composite, {@code null} when failed
 * @param servedFromCache whether no archive call was needed
 * @param message         human-readable summary
 */
public record AcquisitionResult(AcquisitionState state,
                                CacheKey key,
                                CompositeImage composite,
                                boolean servedFromCache,
                                String message) {

    public static AcquisitionResult done(final CacheKey key, final CompositeImage composite, final boolean fromCache) {
        return new AcquisitionResult(AcquisitionState.DONE, key, composite, fromCache,
                fromCache ? "served from cache" : "fused " + composite.frameCount() + " frame(s) from " + composite.source());
    }

    public static AcquisitionResult failed(final CacheKey key, final String message) {
        return new AcquisitionResult(AcquisitionState.FAILED, key, null, false, message);
    }

    public boolean isDone() {
        return state == AcquisitionState.DONE;
    }
}
