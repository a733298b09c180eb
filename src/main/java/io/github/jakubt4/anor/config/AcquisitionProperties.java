package io.github.jakubt4.anor.config;

import io.github.jakubt4.anor.model.ObservationSource;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Search cascade and source catalogue settings ({@code anor.acquisition.*}).
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "anor.acquisition")
public class AcquisitionProperties {

    /** Half widths of the search windows, tried in order. */
    private List<Duration> searchWindows = new ArrayList<>(List.of(
            Duration.ofMinutes(1), Duration.ofMinutes(10), Duration.ofDays(1)));

    /** Upper bound on candidates downloaded for one window. */
    private int maxFrames = 5;

    private List<Source> sources = new ArrayList<>();

    @Getter
    @Setter
    public static class Source {
        private String id;
        private String instrument;
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate availableFrom;
        private ObservationSource.BandKind bandKind = ObservationSource.BandKind.WAVELENGTH;
        private int defaultBand;
        private String defaultDetector;
        private String fallbackSource;
        private Integer fallbackBand;

        public ObservationSource toObservationSource() {
            return new ObservationSource(id, instrument == null ? id : instrument, availableFrom, bandKind,
                    defaultBand, defaultDetector, fallbackSource, fallbackBand);
        }
    }
}
