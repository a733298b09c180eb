package io.github.jakubt4.anor.service.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.anor.config.CacheProperties;
import io.github.jakubt4.anor.model.CacheKey;
import io.github.jakubt4.anor.model.CompositeImage;
import lombok.extern.slf4j.Slf4j;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Disk tier of the composite cache: one {@code <key>.fits} grid (float32, lossless) plus a
 * {@code <key>.json} metadata sidecar per entry.
 *
 * <p>Both files are written under temporary names and moved into place, so a reader never
 * sees a half-written file. The FITS file carries enough header cards to be rendered on its
 * own.
 */
@Slf4j
@Component
public class FitsCompositeStore implements CompositeCache {

    private static final DateTimeFormatter FITS_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS")
            .withZone(ZoneOffset.UTC);

    private final CacheProperties cacheProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public FitsCompositeStore(final CacheProperties cacheProperties, final ObjectMapper objectMapper) {
        this(cacheProperties, objectMapper, Clock.systemUTC());
    }

    FitsCompositeStore(final CacheProperties cacheProperties, final ObjectMapper objectMapper, final Clock clock) {
        this.cacheProperties = cacheProperties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<CompositeImage> get(final CacheKey key) {
        return getEntry(key).map(StoredComposite::composite);
    }

    /**
     * Like {@link #get} but also reports when the entry was written.
     */
    public Optional<StoredComposite> getEntry(final CacheKey key) {
        final var fitsFile = fitsPath(key);
        final var metadataFile = metadataPath(key);
        if (!Files.isRegularFile(fitsFile) || !Files.isRegularFile(metadataFile)) {
            return Optional.empty();
        }
        try {
            final var metadata = objectMapper.readValue(metadataFile.toFile(), CacheEntryMetadata.class);
            if (isExpired(metadata)) {
                log.debug("[CACHE] {} expired (created {})", key, metadata.createdAt());
                return Optional.empty();
            }
            final var data = readGrid(fitsFile);
            if (data.length != metadata.height() || data[0].length != metadata.width()) {
                log.warn("[CACHE] {} is inconsistent: grid {}x{}, metadata {}x{}; treating as absent",
                        key, data[0].length, data.length, metadata.width(), metadata.height());
                return Optional.empty();
            }
            final var composite = new CompositeImage(data, metadata.source(), metadata.band(), metadata.detector(),
                    metadata.frameCount(), metadata.earliest(), metadata.latest(), metadata.geometry(),
                    metadata.snrGain());
            return Optional.of(new StoredComposite(composite, metadata.createdAt()));
        } catch (final IOException | FitsException | RuntimeException e) {
            log.warn("[CACHE] Unreadable entry {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(final CacheKey key, final CompositeImage composite) {
        write(key, composite);
    }

    /**
     * Persists the entry and returns its creation time.
     *
     * @throws CacheWriteException when the entry cannot be persisted
     */
    public Instant write(final CacheKey key, final CompositeImage composite) {
        final var directory = cacheProperties.getDirectory();
        final var suffix = "." + UUID.randomUUID() + ".tmp";
        final var fitsTemp = directory.resolve(key.encode() + ".fits" + suffix);
        final var metadataTemp = directory.resolve(key.encode() + ".json" + suffix);
        try {
            Files.createDirectories(directory);
            writeGrid(composite, fitsTemp);
            final var metadata = metadataOf(key, composite);
            objectMapper.writeValue(metadataTemp.toFile(), metadata);
            moveIntoPlace(fitsTemp, fitsPath(key));
            moveIntoPlace(metadataTemp, metadataPath(key));
            log.info("[CACHE] Stored {} ({}x{}, {} frame(s))", key, composite.width(), composite.height(),
                    composite.frameCount());
            return metadata.createdAt();
        } catch (final IOException | FitsException e) {
            throw new CacheWriteException("Cannot store composite " + key, e);
        } finally {
            deleteQuietly(fitsTemp);
            deleteQuietly(metadataTemp);
        }
    }

    @Override
    public void invalidate(final CacheKey key) {
        try {
            final var removed = Files.deleteIfExists(metadataPath(key)) | Files.deleteIfExists(fitsPath(key));
            if (removed) {
                log.info("[CACHE] Invalidated {}", key);
            }
        } catch (final IOException e) {
            throw new CacheWriteException("Cannot invalidate composite " + key, e);
        }
    }

    @Override
    public void clear() {
        final var directory = cacheProperties.getDirectory();
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (Stream<Path> entries = Files.list(directory)) {
            final var files = entries
                    .filter(path -> {
                        final var name = path.getFileName().toString();
                        return name.endsWith(".fits") || name.endsWith(".json") || name.endsWith(".tmp");
                    })
                    .toList();
            for (final var file : files) {
                Files.deleteIfExists(file);
            }
            log.info("[CACHE] Cleared {} file(s) from {}", files.size(), directory);
        } catch (final IOException e) {
            throw new CacheWriteException("Cannot clear cache directory " + directory, e);
        }
    }

    Path fitsPath(final CacheKey key) {
        return cacheProperties.getDirectory().resolve(key.encode() + ".fits");
    }

    Path metadataPath(final CacheKey key) {
        return cacheProperties.getDirectory().resolve(key.encode() + ".json");
    }

    private boolean isExpired(final CacheEntryMetadata metadata) {
        return isExpired(metadata.createdAt(), cacheProperties.getMaxAge(), clock);
    }

    static boolean isExpired(final Instant createdAt, final Duration maxAge, final Clock clock) {
        if (maxAge == null || createdAt == null) {
            return false;
        }
        return createdAt.plus(maxAge).isBefore(clock.instant());
    }

    private CacheEntryMetadata metadataOf(final CacheKey key, final CompositeImage composite) {
        return new CacheEntryMetadata(composite.source(), composite.band(), key.date(), composite.detector(),
                composite.frameCount(), composite.earliest(), composite.latest(), composite.snrGain(),
                composite.width(), composite.height(), composite.geometry(),
                clock.instant().truncatedTo(ChronoUnit.MILLIS));
    }

    private static float[][] readGrid(final Path file) throws IOException, FitsException {
        try (Fits fits = new Fits(file.toFile())) {
            final BasicHDU<?> hdu = fits.readHDU();
            if (hdu == null || !(hdu.getKernel() instanceof float[][] grid) || grid.length == 0) {
                throw new FitsException("no float32 image in " + file.getFileName());
            }
            return grid;
        }
    }

    private static void writeGrid(final CompositeImage composite, final Path target) throws IOException, FitsException {
        try (Fits fits = new Fits()) {
            final BasicHDU<?> hdu = FitsFactory.hduFactory(composite.data());
            final Header header = hdu.getHeader();
            header.addValue("ORIGIN", "anor", "composite producer");
            header.addValue("INSTRUME", composite.source(), "source identifier");
            if (composite.detector() != null) {
                header.addValue("DETECTOR", composite.detector(), "detector code");
            } else {
                header.addValue("WAVELNTH", composite.band(), "wavelength [Angstrom]");
            }
            header.addValue("NFRAMES", composite.frameCount(), "frames fused");
            if (composite.earliest() != null) {
                header.addValue("DATE-OBS", FITS_TIME.format(composite.earliest()), "earliest contributing frame");
            }
            if (composite.latest() != null) {
                header.addValue("DATE-END", FITS_TIME.format(composite.latest()), "latest contributing frame");
            }
            final var geometry = composite.geometry();
            addIfFinite(header, "CDELT1", geometry.scaleX(), "plate scale x [arcsec/pix]");
            addIfFinite(header, "CDELT2", geometry.scaleY(), "plate scale y [arcsec/pix]");
            addIfFinite(header, "CRPIX1", geometry.referenceX(), "reference pixel x");
            addIfFinite(header, "CRPIX2", geometry.referenceY(), "reference pixel y");
            addIfFinite(header, "CROTA2", geometry.rotationDeg(), "rotation [deg]");
            addIfFinite(header, "RSUN_OBS", geometry.solarRadiusArcsec(), "solar radius [arcsec]");
            fits.addHDU(hdu);
            fits.write(target.toFile());
        }
    }

    private static void addIfFinite(final Header header, final String key, final Double value, final String comment)
            throws FitsException {
        if (value != null && Double.isFinite(value)) {
            header.addValue(key, value, comment);
        }
    }

    private static void moveIntoPlace(final Path source, final Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(final Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (final IOException e) {
            log.debug("[CACHE] Could not remove temporary file {}: {}", path, e.getMessage());
        }
    }
}
