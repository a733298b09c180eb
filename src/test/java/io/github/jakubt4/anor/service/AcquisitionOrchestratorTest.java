package io.github.jakubt4.anor.service;

import io.github.jakubt4.anor.FitsFixtures;
import io.github.jakubt4.anor.client.ArchiveClient;
import io.github.jakubt4.anor.config.AcquisitionProperties;
import io.github.jakubt4.anor.config.ArchiveProperties;
import io.github.jakubt4.anor.config.CacheProperties;
import io.github.jakubt4.anor.dto.CandidateRecord;
import io.github.jakubt4.anor.model.AcquisitionTarget;
import io.github.jakubt4.anor.model.CacheKey;
import io.github.jakubt4.anor.model.ImageFrame;
import io.github.jakubt4.anor.model.SearchWindow;
import io.github.jakubt4.anor.service.cache.CacheWriteException;
import io.github.jakubt4.anor.service.cache.CompositeCache;
import io.github.jakubt4.anor.service.cache.FitsCompositeStore;
import io.github.jakubt4.anor.service.cache.TieredCompositeCache;
import io.github.jakubt4.anor.service.calibration.FrameCalibrator;
import io.github.jakubt4.anor.service.calibration.FrameUnreadableException;
import io.github.jakubt4.anor.service.fusion.FusionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AcquisitionOrchestratorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 1);
    private static final Instant MIDNIGHT = Instant.parse("2024-06-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private ArchiveClient archiveClient;
    private FrameCalibrator frameCalibrator;
    private CompositeCache compositeCache;
    private AcquisitionProperties acquisitionProperties;
    private ArchiveProperties archiveProperties;
    private SourceCatalog sourceCatalog;

    /** Candidates the fake archive returns, keyed by source id and then by window half width. */
    private final Map<String, Map<Duration, List<CandidateRecord>>> archive = new HashMap<>();
    private final Map<Path, ImageFrame> frames = new HashMap<>();

    @BeforeEach
    void setUp() throws Exception {
        archiveClient = Mockito.mock(ArchiveClient.class);
        frameCalibrator = Mockito.mock(FrameCalibrator.class);

        acquisitionProperties = CatalogFixtures.acquisitionProperties();
        sourceCatalog = new SourceCatalog(acquisitionProperties);

        archiveProperties = new ArchiveProperties();
        archiveProperties.setDownloadDirectory(tempDir.resolve("data"));

        final var cacheProperties = new CacheProperties();
        cacheProperties.setDirectory(tempDir.resolve("cache"));
        compositeCache = new TieredCompositeCache(
                new FitsCompositeStore(cacheProperties, Jackson2ObjectMapperBuilder.json().build()),
                cacheProperties);

        when(archiveClient.search(any(), any())).thenAnswer(invocation -> {
            final SearchWindow window = invocation.getArgument(0);
            final AcquisitionTarget target = invocation.getArgument(1);
            final var halfWidth = window.span().dividedBy(2);
            return archive.getOrDefault(target.sourceId(), Map.of()).getOrDefault(halfWidth, List.of());
        });
        when(archiveClient.download(anyList(), any())).thenAnswer(invocation -> {
            final List<CandidateRecord> candidates = invocation.getArgument(0);
            final Path directory = invocation.getArgument(1);
            return candidates.stream().map(candidate -> directory.resolve(candidate.localFileName())).toList();
        });
        when(frameCalibrator.calibrate(any())).thenAnswer(invocation -> {
            final Path file = invocation.getArgument(0);
            final var frame = frames.get(file.getFileName());
            if (frame == null) {
                throw new FrameUnreadableException("Cannot read " + file.getFileName());
            }
            return frame;
        });
    }

    private AcquisitionOrchestrator orchestrator() {
        return new AcquisitionOrchestrator(sourceCatalog, archiveClient, frameCalibrator, new FusionEngine(),
                compositeCache, acquisitionProperties, archiveProperties);
    }

    private void offer(final String source, final Duration halfWidth, final float... values) {
        final var records = new ArrayList<CandidateRecord>();
        for (int i = 0; i < values.length; i++) {
            final var name = source + "_" + halfWidth.toMinutes() + "_" + i + ".fits";
            final var observedAt = MIDNIGHT.plusSeconds(12L * i);
            records.add(new CandidateRecord(name, name, "https://archive.test/files/" + name, observedAt,
                    observedAt.plusSeconds(3), source, 211, null, "TEST"));
            frames.put(Path.of(name), new ImageFrame(FitsFixtures.filled(4, 4, values[i]), observedAt, 10.0,
                    source, 211, null, null, name, true));
        }
        archive.computeIfAbsent(source, ignored -> new HashMap<>()).put(halfWidth, records);
    }

    @Test
    void threeFramesInFirstWindowAreFusedAndCached() {
        offer("SDO-AIA", Duration.ofMinutes(1), 1f, 2f, 3f);

        final var result = orchestrator().acquire(AcquisitionRequest.forDate(DAY));

        assertThat(result.state()).isEqualTo(AcquisitionState.DONE);
        assertThat(result.servedFromCache()).isFalse();
        assertThat(result.key()).isEqualTo(new CacheKey("SDO-AIA", 211, DAY));
        assertThat(result.composite().frameCount()).isEqualTo(3);
        assertThat(result.composite().data()[2][2]).isEqualTo(2f);
        assertThat(result.composite().source()).isEqualTo("SDO-AIA");
        assertThat(result.composite().earliest()).isEqualTo(MIDNIGHT);
        assertThat(compositeCache.get(result.key())).isPresent();
        verify(archiveClient, times(1)).search(any(), any());
        verify(archiveClient).download(anyList(), Mockito.eq(tempDir.resolve("data").resolve("SDO-AIA")));
    }

    @Test
    void firstWindowIsCentredOnMidnight() {
        offer("SDO-AIA", Duration.ofMinutes(1), 1f);

        orchestrator().acquire(AcquisitionRequest.forDate(DAY));

        final var windows = ArgumentCaptor.forClass(SearchWindow.class);
        verify(archiveClient).search(windows.capture(), any());
        assertThat(windows.getValue().start()).isEqualTo(MIDNIGHT.minusSeconds(60));
        assertThat(windows.getValue().end()).isEqualTo(MIDNIGHT.plusSeconds(60));
    }

    @Test
    void secondRequestIsServedFromCacheWithoutArchiveCalls() {
        offer("SDO-AIA", Duration.ofMinutes(1), 1f, 2f, 3f);
        final var orchestrator = orchestrator();

        final var first = orchestrator.acquire(AcquisitionRequest.forDate(DAY));
        final var second = orchestrator.acquire(AcquisitionRequest.forDate(DAY));

        assertThat(second.state()).isEqualTo(AcquisitionState.DONE);
        assertThat(second.servedFromCache()).isTrue();
        assertThat(second.composite().data()).isEqualTo(first.composite().data());
        verify(archiveClient, times(1)).search(any(), any());
        verify(archiveClient, times(1)).download(anyList(), any());
    }

    @Test
    void forceRefreshQueriesArchiveAgain() {
        offer("SDO-AIA", Duration.ofMinutes(1), 1f);
        final var orchestrator = orchestrator();
        orchestrator.acquire(AcquisitionRequest.forDate(DAY));

        final var refreshed = orchestrator.acquire(new AcquisitionRequest(DAY, null, null, null, true));

        assertThat(refreshed.servedFromCache()).isFalse();
        verify(archiveClient, times(2)).search(any(), any());
    }

    @Test
    void emptyWindowWidensToNext() {
        offer("SDO-AIA", Duration.ofMinutes(10), 5f, 7f);

        final var result = orchestrator().acquire(AcquisitionRequest.forDate(DAY));

        assertThat(result.isDone()).isTrue();
        assertThat(result.composite().frameCount()).isEqualTo(2);
        assertThat(result.composite().data()[0][0]).isEqualTo(6f);
        final var windows = ArgumentCaptor.forClass(SearchWindow.class);
        verify(archiveClient, times(2)).search(windows.capture(), any());
        assertThat(windows.getAllValues()).extracting(SearchWindow::span)
                .containsExactly(Duration.ofMinutes(2), Duration.ofMinutes(20));
    }

    @Test
    void windowWhoseFilesAreAllUnreadableWidensToNext() {
        offer("SDO-AIA", Duration.ofMinutes(1), 1f, 1f);
        frames.keySet().removeIf(path -> path.toString().startsWith("SDO-AIA_1_"));
        offer("SDO-AIA", Duration.ofMinutes(10), 4f);

        final var result = orchestrator().acquire(AcquisitionRequest.forDate(DAY));

        assertThat(result.isDone()).isTrue();
        assertThat(result.composite().data()[0][0]).isEqualTo(4f);
    }

    @Test
    void unreadableFileIsSkippedAndTheRestFused() {
        offer("SDO-AIA", Duration.ofMinutes(1), 2f, 100f, 4f);
        frames.remove(Path.of("SDO-AIA_1_1.fits"));

        final var result = orchestrator().acquire(AcquisitionRequest.forDate(DAY));

        assertThat(result.composite().frameCount()).isEqualTo(2);
        assertThat(result.composite().data()[1][1]).isEqualTo(3f);
    }

    @Test
    void candidatesAreCappedAtMaxFrames() {
        acquisitionProperties.setMaxFrames(2);
        offer("SDO-AIA", Duration.ofMinutes(1), 1f, 3f, 100f);

        final var result = orchestrator().acquire(AcquisitionRequest.forDate(DAY));

        assertThat(result.composite().frameCount()).isEqualTo(2);
        assertThat(result.composite().data()[0][0]).isEqualTo(2f);
    }

    @Test
    void primaryWithoutDataFallsBackAndCachesUnderBothKeys() {
        offer("SOHO-EIT", Duration.ofDays(1), 8f);

        final var result = orchestrator().acquire(AcquisitionRequest.forDate(DAY));

        assertThat(result.state()).isEqualTo(AcquisitionState.DONE);
        assertThat(result.key()).isEqualTo(new CacheKey("SDO-AIA", 211, DAY));
        assertThat(result.composite().source()).isEqualTo("SOHO-EIT");
        assertThat(result.composite().band()).isEqualTo(195);
        assertThat(compositeCache.get(new CacheKey("SDO-AIA", 211, DAY))).isPresent();
        assertThat(compositeCache.get(new CacheKey("SOHO-EIT", 195, DAY))).isPresent();
        // three AIA windows, then the first EIT windows up to the one with data
        verify(archiveClient, times(6)).search(any(), any());
    }

    @Test
    void nothingAnywhereEndsInFailedResult() {
        final var result = orchestrator().acquire(AcquisitionRequest.forDate(DAY));

        assertThat(result.state()).isEqualTo(AcquisitionState.FAILED);
        assertThat(result.isDone()).isFalse();
        assertThat(result.composite()).isNull();
        assertThat(result.message()).contains("No data").contains("SDO-AIA");
        verify(archiveClient, never()).download(anyList(), any());
        assertThat(compositeCache.get(result.key())).isEmpty();
    }

    @Test
    void cacheWriteFailureStillReturnsComposite() {
        compositeCache = Mockito.mock(CompositeCache.class);
        when(compositeCache.get(any())).thenReturn(Optional.empty());
        doThrow(new CacheWriteException("read-only filesystem", null)).when(compositeCache).put(any(), any());
        offer("SDO-AIA", Duration.ofMinutes(1), 1f);

        final var result = orchestrator().acquire(AcquisitionRequest.forDate(DAY));

        assertThat(result.isDone()).isTrue();
        assertThat(result.composite().frameCount()).isEqualTo(1);
    }

    @Test
    void fallbackChainStopsAtCycles() {
        acquisitionProperties.getSources().get(1).setFallbackSource("SDO-AIA");
        acquisitionProperties.getSources().get(1).setFallbackBand(211);
        sourceCatalog = new SourceCatalog(acquisitionProperties);
        final var target = sourceCatalog.resolve(AcquisitionRequest.forDate(DAY));

        assertThat(orchestrator().targetChain(target)).extracting(AcquisitionTarget::sourceId)
                .containsExactly("SDO-AIA", "SOHO-EIT");
    }

    @Test
    void unknownSourceIsRejected() {
        assertThatThrownBy(() -> orchestrator().acquire(new AcquisitionRequest(DAY, "TRACE", null, null, false)))
                .isInstanceOf(IllegalArgumentException.class);
        verify(archiveClient, never()).search(any(), any());
    }
}
