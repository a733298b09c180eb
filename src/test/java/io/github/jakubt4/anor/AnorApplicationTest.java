package io.github.jakubt4.anor;

import io.github.jakubt4.anor.client.ArchiveClient;
import io.github.jakubt4.anor.dto.CandidateRecord;
import io.github.jakubt4.anor.service.AcquisitionOrchestrator;
import io.github.jakubt4.anor.service.AcquisitionRequest;
import io.github.jakubt4.anor.service.AcquisitionState;
import io.github.jakubt4.anor.service.cache.CompositeCache;
import nom.tam.fits.FitsException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Runs the wired pipeline against FITS files produced by a stubbed archive.
 */
@SpringBootTest
class AnorApplicationTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 1);
    private static final Path WORK_DIR = createWorkDir();

    @DynamicPropertySource
    static void directories(final DynamicPropertyRegistry registry) {
        registry.add("anor.cache.directory", () -> WORK_DIR.resolve("cache").toString());
        registry.add("anor.archive.download-directory", () -> WORK_DIR.resolve("data").toString());
    }

    @MockBean
    private ArchiveClient archiveClient;

    @Autowired
    private AcquisitionOrchestrator acquisitionOrchestrator;

    @Autowired
    private CompositeCache compositeCache;

    @BeforeEach
    void setUp() {
        Mockito.reset(archiveClient);
        compositeCache.clear();
    }

    @Test
    void calibratesAndFusesDownloadedFrames() {
        final var candidates = List.of(candidate("aia_0.fits", 0), candidate("aia_1.fits", 12));
        when(archiveClient.search(any(), any())).thenReturn(candidates);
        when(archiveClient.download(anyList(), any())).thenAnswer(invocation -> {
            final Path directory = invocation.getArgument(1);
            final var values = new float[]{4f, 8f};
            final var files = new ArrayList<Path>();
            try {
                Files.createDirectories(directory);
                for (int i = 0; i < candidates.size(); i++) {
                    final var file = directory.resolve(candidates.get(i).localFileName());
                    files.add(FitsFixtures.write(file, FitsFixtures.filled(4, 4, values[i]),
                            FitsFixtures.aiaCards(4, 4, 2.0, "2024-06-01T00:00:" + (10 + 12 * i))));
                }
            } catch (final IOException | FitsException e) {
                throw new UncheckedIOException(new IOException(e));
            }
            return files;
        });

        final var result = acquisitionOrchestrator.acquire(AcquisitionRequest.forDate(DAY));

        assertThat(result.state()).isEqualTo(AcquisitionState.DONE);
        assertThat(result.composite().frameCount()).isEqualTo(2);
        // exposure-normalised 2 and 4 counts/s, equal weights
        assertThat(result.composite().data()[1][2]).isEqualTo(3f);
        assertThat(result.composite().earliest()).isEqualTo(Instant.parse("2024-06-01T00:00:10Z"));
        assertThat(WORK_DIR.resolve("cache").resolve("SDO-AIA_211_20240601.fits")).exists();

        final var again = acquisitionOrchestrator.acquire(AcquisitionRequest.forDate(DAY));

        assertThat(again.servedFromCache()).isTrue();
        verify(archiveClient, times(1)).search(any(), any());
    }

    @Test
    void emptyArchiveFailsWithoutException() {
        when(archiveClient.search(any(), any())).thenReturn(List.of());

        final var result = acquisitionOrchestrator.acquire(AcquisitionRequest.forDate(LocalDate.of(1999, 2, 3)));

        assertThat(result.state()).isEqualTo(AcquisitionState.FAILED);
        assertThat(result.key().source()).isEqualTo("SOHO-EIT");
    }

    private static CandidateRecord candidate(final String name, final int offsetSeconds) {
        final var start = Instant.parse("2024-06-01T00:00:00Z").plusSeconds(offsetSeconds);
        return new CandidateRecord(name, name, "https://archive.test/" + name, start, start.plusSeconds(2),
                "AIA", 211, null, "TEST");
    }

    private static Path createWorkDir() {
        try {
            return Files.createTempDirectory("anor-it");
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
