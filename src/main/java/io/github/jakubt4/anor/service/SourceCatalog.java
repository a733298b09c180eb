package io.github.jakubt4.anor.service;

import io.github.jakubt4.anor.config.AcquisitionProperties;
import io.github.jakubt4.anor.model.AcquisitionTarget;
import io.github.jakubt4.anor.model.CacheKey;
import io.github.jakubt4.anor.model.ObservationSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Configured observation sources and the rules for choosing among them.
 */
@Slf4j
@Component
public class SourceCatalog {

    private final List<ObservationSource> sources;

    public SourceCatalog(final AcquisitionProperties acquisitionProperties) {
        this.sources = acquisitionProperties.getSources().stream()
                .map(AcquisitionProperties.Source::toObservationSource)
                .toList();
        if (sources.isEmpty()) {
            throw new IllegalStateException("No observation sources configured (anor.acquisition.sources)");
        }
        for (final var source : sources) {
            if (source.id() == null || !CacheKey.SOURCE_ID.matcher(source.id()).matches()) {
                throw new IllegalStateException(
                        "Source id '" + source.id() + "' must match " + CacheKey.SOURCE_ID.pattern());
            }
        }
    }

    public List<ObservationSource> all() {
        return sources;
    }

    public Optional<ObservationSource> find(final String id) {
        if (id == null) {
            return Optional.empty();
        }
        return sources.stream()
                .filter(source -> source.id().equalsIgnoreCase(id.trim()))
                .findFirst();
    }

    /**
     * The most recent source already available on {@code date}; when none is, the source
     * with the earliest availability.
     */
    public ObservationSource select(final LocalDate date) {
        final Comparator<ObservationSource> byAvailability = Comparator.comparing(
                ObservationSource::availableFrom, Comparator.nullsFirst(Comparator.naturalOrder()));
        return sources.stream()
                .filter(source -> source.isAvailableOn(date))
                .max(byAvailability)
                .orElseGet(() -> sources.stream().min(byAvailability).orElseThrow());
    }

    /**
     * Resolves the request into a concrete target.
     *
     * @throws IllegalArgumentException for an unknown source id
     */
    public AcquisitionTarget resolve(final AcquisitionRequest request) {
        final ObservationSource source;
        if (request.isAutoSource()) {
            source = select(request.date());
        } else {
            source = find(request.source())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown source '" + request.source()
                            + "', known: " + sources.stream().map(ObservationSource::id).toList()));
            if (!source.isAvailableOn(request.date())) {
                final var replacement = select(request.date());
                log.info("[CATALOG] {} has no data before {}, using {} for {}",
                        source.id(), source.availableFrom(), replacement.id(), request.date());
                if (!replacement.id().equals(source.id())) {
                    return target(replacement, null, null);
                }
            }
        }
        return target(source, request.band(), request.detector());
    }

    /**
     * The target to retry with when {@code target} produced nothing, if one is configured.
     */
    public Optional<AcquisitionTarget> fallbackFor(final AcquisitionTarget target) {
        final var source = target.source();
        if (!source.hasFallback()) {
            return Optional.empty();
        }
        final var fallback = find(source.fallbackSource());
        if (fallback.isEmpty()) {
            log.warn("[CATALOG] {} names unknown fallback source '{}'", source.id(), source.fallbackSource());
            return Optional.empty();
        }
        return Optional.of(target(fallback.get(), source.fallbackBand(), null));
    }

    static AcquisitionTarget target(final ObservationSource source, final Integer band, final String detector) {
        if (source.bandKind() == ObservationSource.BandKind.DETECTOR) {
            final String code;
            if (detector != null && !detector.isBlank()) {
                code = detector.trim().toUpperCase(Locale.ROOT);
            } else if (band != null) {
                code = "C" + band;
            } else {
                code = source.defaultDetector();
            }
            return new AcquisitionTarget(source, detectorNumber(code, source.defaultBand()), code);
        }
        return new AcquisitionTarget(source, band != null ? band : source.defaultBand(), null);
    }

    private static int detectorNumber(final String code, final int defaultBand) {
        final var digits = code == null ? "" : code.replaceAll("\\D", "");
        return digits.isEmpty() ? defaultBand : Integer.parseInt(digits);
    }
}
