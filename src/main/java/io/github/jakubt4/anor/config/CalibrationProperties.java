package io.github.jakubt4.anor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Frame calibration settings ({@code anor.calibration.*}).
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "anor.calibration")
public class CalibrationProperties {

    /** Target plate scale in arcsec/pixel, keyed by instrument name fragment (e.g. "AIA" -> 0.6). */
    private Map<String, Double> plateScales = new LinkedHashMap<>();

    public Optional<Double> plateScaleFor(final String instrument) {
        if (instrument == null) {
            return Optional.empty();
        }
        final var upper = instrument.toUpperCase(Locale.ROOT);
        return plateScales.entrySet().stream()
                .filter(entry -> upper.contains(entry.getKey().toUpperCase(Locale.ROOT)))
                .map(Map.Entry::getValue)
                .findFirst();
    }
}
