package io.github.jakubt4.anor.service;

import io.github.jakubt4.anor.client.ArchiveClient;
import io.github.jakubt4.anor.config.AcquisitionProperties;
import io.github.jakubt4.anor.config.ArchiveProperties;
import io.github.jakubt4.anor.model.AcquisitionTarget;
import io.github.jakubt4.anor.model.CacheKey;
import io.github.jakubt4.anor.model.CompositeImage;
import io.github.jakubt4.anor.model.SearchWindow;
import io.github.jakubt4.anor.service.cache.CacheWriteException;
import io.github.jakubt4.anor.service.cache.CompositeCache;
import io.github.jakubt4.anor.service.calibration.FrameCalibrator;
import io.github.jakubt4.anor.service.calibration.FrameUnreadableException;
import io.github.jakubt4.anor.service.fusion.FusionEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Drives one acquisition from cache lookup through search, download, calibration and
 * fusion to the cache write.
 *
 * <p>Search windows widen in the configured order, centred on UTC midnight of the
 * requested day. When the primary source runs out of windows its fallback chain is
 * tried. Running out of data is reported as a {@link AcquisitionState#FAILED} result,
 * never as an exception.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AcquisitionOrchestrator {

    private final SourceCatalog sourceCatalog;
    private final ArchiveClient archiveClient;
    private final FrameCalibrator frameCalibrator;
    private final FusionEngine fusionEngine;
    private final CompositeCache compositeCache;
    private final AcquisitionProperties acquisitionProperties;
    private final ArchiveProperties archiveProperties;

    /**
     * @throws IllegalArgumentException when the request names an unknown source
     */
    public AcquisitionResult acquire(final AcquisitionRequest request) {
        final var target = sourceCatalog.resolve(request);
        final var key = target.cacheKey(request.date());

        transition(key, AcquisitionState.CHECK_CACHE);
        if (request.forceRefresh()) {
            log.info("[ACQUIRE] {} refresh forced, cache bypassed", key);
        } else {
            final var cached = compositeCache.get(key);
            if (cached.isPresent()) {
                transition(key, AcquisitionState.DONE);
                return AcquisitionResult.done(key, cached.get(), true);
            }
        }

        for (final var candidate : targetChain(target)) {
            if (candidate != target) {
                log.info("[ACQUIRE] {} yielded nothing, falling back to {}", target, candidate);
            }
            final var composite = acquireFrom(candidate, request.date(), key);
            if (composite.isPresent()) {
                transition(key, AcquisitionState.CACHE_WRITE);
                store(key, composite.get());
                final var ownKey = candidate.cacheKey(request.date());
                if (!ownKey.equals(key)) {
                    store(ownKey, composite.get());
                }
                transition(key, AcquisitionState.DONE);
                return AcquisitionResult.done(key, composite.get(), false);
            }
        }

        transition(key, AcquisitionState.FAILED);
        return AcquisitionResult.failed(key, "No data for " + target + " on " + request.date());
    }

    /**
     * The requested target followed by its fallbacks; a source seen before ends the chain.
     */
    List<AcquisitionTarget> targetChain(final AcquisitionTarget target) {
        final var chain = new ArrayList<AcquisitionTarget>();
        final var seen = new HashSet<String>();
        var current = Optional.of(target);
        while (current.isPresent() && seen.add(current.get().sourceId())) {
            chain.add(current.get());
            current = sourceCatalog.fallbackFor(current.get());
        }
        return chain;
    }

    private Optional<CompositeImage> acquireFrom(final AcquisitionTarget target, final LocalDate date, final CacheKey key) {
        final var center = date.atStartOfDay().toInstant(ZoneOffset.UTC);
        final var directory = archiveProperties.getDownloadDirectory().resolve(target.sourceId());

        for (final var window : SearchWindow.cascade(center, acquisitionProperties.getSearchWindows())) {
            transition(key, AcquisitionState.SEARCH);
            final var found = archiveClient.search(window, target);
            log.info("[ACQUIRE] {} window {} .. {}: {} candidate(s)", target, window.start(), window.end(), found.size());
            if (found.isEmpty()) {
                continue;
            }

            transition(key, AcquisitionState.DOWNLOAD);
            final var candidates = found.stream().limit(Math.max(1, acquisitionProperties.getMaxFrames())).toList();
            final var files = archiveClient.download(candidates, directory);
            if (files.size() < candidates.size()) {
                log.warn("[ACQUIRE] {} partial download: {}/{} file(s)", target, files.size(), candidates.size());
            }
            if (files.isEmpty()) {
                continue;
            }

            transition(key, AcquisitionState.CALIBRATE_EACH);
            final var accumulator = fusionEngine.accumulator(target.sourceId(), target.band(), target.detector());
            for (final var file : files) {
                try {
                    accumulator.add(frameCalibrator.calibrate(file));
                } catch (final FrameUnreadableException e) {
                    log.warn("[ACQUIRE] Skipping {}: {}", file.getFileName(), e.getMessage());
                }
            }
            if (accumulator.frameCount() == 0) {
                log.warn("[ACQUIRE] {} no usable frame in window {} .. {}", target, window.start(), window.end());
                continue;
            }

            transition(key, AcquisitionState.FUSE);
            return Optional.of(accumulator.toComposite());
        }
        return Optional.empty();
    }

    private void store(final CacheKey key, final CompositeImage composite) {
        try {
            compositeCache.put(key, composite);
        } catch (final CacheWriteException e) {
            log.warn("[ACQUIRE] Cache write failed for {}: {}", key, e.getMessage());
        }
    }

    private static void transition(final CacheKey key, final AcquisitionState state) {
        log.debug("[ACQUIRE] {} -> {}", key, state);
    }
}
