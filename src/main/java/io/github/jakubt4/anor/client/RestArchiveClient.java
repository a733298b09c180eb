package io.github.jakubt4.anor.client;

import io.github.jakubt4.anor.config.ArchiveProperties;
import io.github.jakubt4.anor.dto.CandidateRecord;
import io.github.jakubt4.anor.dto.CatalogSearchResponse;
import io.github.jakubt4.anor.model.AcquisitionTarget;
import io.github.jakubt4.anor.model.SearchWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ArchiveClient} speaking the archive's JSON search API over {@link RestClient}.
 *
 * <p>Searches are retried through {@code @Retryable}; once attempts run out the archive is
 * treated as having returned nothing. Downloads are retried per file with a fixed backoff and
 * a file that still fails is left out of the result instead of failing the batch.
 */
@Slf4j
@Service
public class RestArchiveClient implements ArchiveClient {

    private static final String SEARCH_PATH = "/search";

    private final RestClient restClient;
    private final RetryTemplate downloadRetry;
    private final List<String> httpsHosts;

    public RestArchiveClient(final RestClient.Builder restClientBuilder,
                             final ArchiveProperties archiveProperties) {
        this.restClient = restClientBuilder
                .baseUrl(archiveProperties.getBaseUrl())
                .build();
        this.downloadRetry = buildDownloadRetry(archiveProperties.getRetry());
        this.httpsHosts = List.copyOf(archiveProperties.getHttpsHosts());
    }

    private static RetryTemplate buildDownloadRetry(final ArchiveProperties.Retry retry) {
        final var builder = RetryTemplate.builder()
                .maxAttempts(Math.max(1, retry.getMaxAttempts()))
                .retryOn(List.of(RestClientException.class, UncheckedIOException.class));
        if (retry.getDelayMs() > 0) {
            builder.fixedBackoff(retry.getDelayMs());
        } else {
            builder.noBackoff();
        }
        return builder.build();
    }

    @Override
    @Retryable(retryFor = RestClientException.class,
               maxAttemptsExpression = "${anor.archive.retry.max-attempts:3}",
               backoff = @Backoff(delayExpression = "${anor.archive.retry.delay-ms:5000}"))
    public List<CandidateRecord> search(final SearchWindow window, final AcquisitionTarget target) {
        final var response = restClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path(SEARCH_PATH)
                            .queryParam("start", window.start())
                            .queryParam("end", window.end())
                            .queryParam("instrument", target.source().instrument());
                    if (target.isDetectorBand()) {
                        uriBuilder.queryParam("detector", target.detector());
                    } else {
                        uriBuilder.queryParam("wavelength", target.band());
                    }
                    return uriBuilder.build();
                })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(CatalogSearchResponse.class);

        final var records = response == null ? List.<CandidateRecord>of() : response.recordsOrEmpty();
        log.info("[ARCHIVE] {} record(s) for {} in {} .. {}",
                records.size(), target, window.start(), window.end());
        return records;
    }

    @Recover
    public List<CandidateRecord> recoverSearch(final RestClientException e,
                                               final SearchWindow window, final AcquisitionTarget target) {
        log.warn("[ARCHIVE] Search for {} in {} .. {} failed after retries, treating as empty: {}",
                target, window.start(), window.end(), e.getMessage());
        return List.of();
    }

    @Override
    public List<Path> download(final List<CandidateRecord> candidates, final Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (final IOException e) {
            log.error("[ARCHIVE] Cannot create download directory {}: {}", directory, e.getMessage());
            return List.of();
        }

        final var files = new ArrayList<Path>(candidates.size());
        for (final var candidate : candidates) {
            final Path target;
            try {
                target = localPath(directory, candidate);
            } catch (final IllegalArgumentException e) {
                log.warn("[ARCHIVE] Skipping record {}: {}", candidate.id(), e.getMessage());
                continue;
            }
            if (Files.exists(target)) {
                log.debug("[ARCHIVE] Reusing already downloaded {}", target.getFileName());
                files.add(target);
                continue;
            }
            try {
                downloadRetry.execute(context -> {
                    if (context.getRetryCount() > 0) {
                        log.info("[ARCHIVE] Retrying {} (attempt {})", target.getFileName(),
                                context.getRetryCount() + 1);
                    }
                    fetchTo(candidate, target);
                    return target;
                });
                files.add(target);
            } catch (final RuntimeException e) {
                log.warn("[ARCHIVE] Giving up on {}: {}", target.getFileName(), e.getMessage());
            }
        }

        if (files.size() < candidates.size()) {
            log.warn("[ARCHIVE] Partial download: {}/{} file(s) retrieved", files.size(), candidates.size());
        }
        return files;
    }

    /**
     * Where a record is stored locally: its bare file name inside {@code directory}.
     *
     * @throws IllegalArgumentException when the record carries no usable name or the name
     *                                  would escape the directory
     */
    static Path localPath(final Path directory, final CandidateRecord candidate) {
        final var name = Path.of(candidate.localFileName()).getFileName();
        if (name == null) {
            throw new IllegalArgumentException("no file name in record");
        }
        final var target = directory.resolve(name);
        if (!target.normalize().startsWith(directory.normalize()) || target.normalize().equals(directory.normalize())) {
            throw new IllegalArgumentException("file name '" + name + "' escapes " + directory);
        }
        return target;
    }

    private void fetchTo(final CandidateRecord candidate, final Path target) {
        final var url = upgradeToHttps(candidate.url());
        final RestClient.RequestHeadersSpec<?> request = url.startsWith("http://") || url.startsWith("https://")
                ? restClient.get().uri(URI.create(url))
                : restClient.get().uri(url);
        final var bytes = request.retrieve().body(byte[].class);
        if (bytes == null || bytes.length == 0) {
            throw new RestClientException("Empty response body for " + url);
        }

        final var partial = target.resolveSibling(target.getFileName() + ".part");
        try {
            Files.write(partial, bytes);
            Files.move(partial, target);
            log.info("[ARCHIVE] Downloaded {} ({} bytes)", target.getFileName(), bytes.length);
        } catch (final FileAlreadyExistsException e) {
            log.debug("[ARCHIVE] {} appeared concurrently, keeping existing copy", target.getFileName());
            deleteQuietly(partial);
        } catch (final IOException e) {
            deleteQuietly(partial);
            throw new UncheckedIOException(e);
        }
    }

    String upgradeToHttps(final String url) {
        if (url == null || !url.startsWith("http://")) {
            return url;
        }
        final var host = URI.create(url).getHost();
        if (host != null && httpsHosts.contains(host)) {
            return "https://" + url.substring("http://".length());
        }
        return url;
    }

    private static void deleteQuietly(final Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (final IOException e) {
            log.debug("[ARCHIVE] Could not remove {}: {}", path, e.getMessage());
        }
    }
}
