package io.github.jakubt4.anor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.jakubt4.anor.model.CompositeImage;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Response returned after a composite request.
 *
 * @param status          {@code "DONE"}, {@code "NO_DATA"} or {@code "REJECTED"}
 * @param message         human-readable detail about the result
 * @param source          source the composite was built from (the fallback source when one was used)
 * @param band            band of the composite
 * @param detector        detector code, absent for imagers
 * @param date            requested day
 * @param frameCount      frames fused into the composite
 * @param earliest        earliest contributing observation
 * @param latest          latest contributing observation
 * @param snrGain         signal-to-noise gain estimate, absent when not computable
 * @param width           composite width in pixels
 * @param height          composite height in pixels
 * @param servedFromCache whether the archive was consulted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompositeResponse(String status,
                                String message,
                                String source,
                                Integer band,
                                String detector,
                                LocalDate date,
                                Integer frameCount,
                                Instant earliest,
                                Instant latest,
                                Double snrGain,
                                Integer width,
                                Integer height,
                                Boolean servedFromCache) {

    public static CompositeResponse done(final LocalDate date, final CompositeImage composite,
                                         final boolean servedFromCache, final String message) {
        return new CompositeResponse("DONE", message, composite.source(), composite.band(), composite.detector(),
                date, composite.frameCount(), composite.earliest(), composite.latest(), composite.snrGain(),
                composite.width(), composite.height(), servedFromCache);
    }

    public static CompositeResponse noData(final LocalDate date, final String message) {
        return new CompositeResponse("NO_DATA", message, null, null, null, date,
                null, null, null, null, null, null, null);
    }

    public static CompositeResponse rejected(final String message) {
        return new CompositeResponse("REJECTED", message, null, null, null, null,
                null, null, null, null, null, null, null);
    }
}
