package io.github.jakubt4.anor.controller;

import io.github.jakubt4.anor.dto.CompositeRequest;
import io.github.jakubt4.anor.dto.CompositeResponse;
import io.github.jakubt4.anor.model.CacheKey;
import io.github.jakubt4.anor.model.ObservationSource;
import io.github.jakubt4.anor.service.AcquisitionOrchestrator;
import io.github.jakubt4.anor.service.AcquisitionRequest;
import io.github.jakubt4.anor.service.SourceCatalog;
import io.github.jakubt4.anor.service.cache.CacheWriteException;
import io.github.jakubt4.anor.service.cache.CompositeCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * REST endpoints for composite acquisition and cache maintenance.
 *
 * <p>{@code POST /api/composites} runs (or serves from cache) one acquisition for a day,
 * source and band.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CompositeController {

    private final AcquisitionOrchestrator acquisitionOrchestrator;
    private final SourceCatalog sourceCatalog;
    private final CompositeCache compositeCache;

    /**
     * Acquires the composite for the requested day.
     *
     * @return {@code 200 OK} with DONE status, {@code 404 Not Found} with NO_DATA when the
     *         archive had nothing usable, {@code 400 Bad Request} with REJECTED for invalid input
     */
    @PostMapping("/composites")
    public ResponseEntity<CompositeResponse> acquire(@RequestBody final CompositeRequest request) {
        if (request.date() == null || request.date().isBlank()) {
            return ResponseEntity.badRequest().body(CompositeResponse.rejected("Date is required"));
        }
        final LocalDate date;
        try {
            date = LocalDate.parse(request.date().trim());
        } catch (final DateTimeParseException e) {
            return ResponseEntity.badRequest()
                    .body(CompositeResponse.rejected("Invalid date '" + request.date() + "', expected yyyy-MM-dd"));
        }

        final var acquisition = new AcquisitionRequest(date, request.source(), request.band(), request.detector(),
                Boolean.TRUE.equals(request.forceRefresh()));
        try {
            final var result = acquisitionOrchestrator.acquire(acquisition);
            if (result.isDone()) {
                log.info("Composite {} ready: {}", result.key(), result.message());
                return ResponseEntity.ok(CompositeResponse.done(date, result.composite(),
                        result.servedFromCache(), result.message()));
            }
            log.info("No composite for {}: {}", result.key(), result.message());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(CompositeResponse.noData(date, result.message()));
        } catch (final IllegalArgumentException e) {
            log.warn("Rejected composite request for {}: {}", date, e.getMessage());
            return ResponseEntity.badRequest().body(CompositeResponse.rejected(e.getMessage()));
        }
    }

    @DeleteMapping("/composites/{source}/{band}/{date}")
    public ResponseEntity<Void> invalidate(@PathVariable final String source,
                                           @PathVariable final int band,
                                           @PathVariable final String date) {
        final var known = sourceCatalog.find(source);
        if (known.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        final LocalDate day;
        try {
            day = LocalDate.parse(date);
        } catch (final DateTimeParseException e) {
            return ResponseEntity.badRequest().build();
        }
        try {
            compositeCache.invalidate(new CacheKey(known.get().id(), band, day));
            return ResponseEntity.noContent().build();
        } catch (final CacheWriteException e) {
            log.error("Cache invalidation failed: {}", e.getMessage());
            return ResponseEntity.internalServerError().build();
        }
    }

    @DeleteMapping("/composites")
    public ResponseEntity<Void> clear() {
        try {
            compositeCache.clear();
            return ResponseEntity.noContent().build();
        } catch (final CacheWriteException e) {
            log.error("Cache clear failed: {}", e.getMessage());
            return ResponseEntity.internalServerError().build();
        }
    }

    @GetMapping("/sources")
    public List<ObservationSource> sources() {
        return sourceCatalog.all();
    }
}
