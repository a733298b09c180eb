package io.github.jakubt4.anor.service.calibration;

import io.github.jakubt4.anor.model.FrameGeometry;
import io.github.jakubt4.anor.model.ImageFrame;
import lombok.extern.slf4j.Slf4j;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.ImageHDU;
import nom.tam.image.compression.hdu.CompressedImageHDU;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Reads the first two-dimensional image HDU of a FITS file into an {@link ImageFrame}.
 *
 * <p>Tile-compressed HDUs are decompressed, {@code BSCALE}/{@code BZERO} are applied and
 * integer {@code BLANK} samples become NaN.
 */
@Slf4j
@Component
public class FitsFrameReader {

    private static final String[] TIME_KEYS = {"DATE-OBS", "T_OBS", "DATE_OBS"};

    public ImageFrame read(final Path file) throws FrameUnreadableException {
        try (Fits fits = new Fits(file.toFile())) {
            final BasicHDU<?>[] hdus = fits.read();
            if (hdus != null) {
                for (final BasicHDU<?> hdu : hdus) {
                    final BasicHDU<?> image = hdu instanceof CompressedImageHDU compressed
                            ? compressed.asImageHDU()
                            : hdu;
                    if (image instanceof ImageHDU && isGrid(image.getKernel())) {
                        return toFrame(image.getHeader(), image.getKernel(), file);
                    }
                }
            }
            throw new FrameUnreadableException("No 2-D image HDU in " + file.getFileName());
        } catch (final FitsException | IOException | RuntimeException e) {
            throw new FrameUnreadableException("Cannot read " + file.getFileName() + " as FITS: " + e.getMessage(), e);
        }
    }

    static boolean isGrid(final Object kernel) {
        if (kernel instanceof float[][] f) {
            return f.length > 0 && f[0].length > 0;
        }
        if (kernel instanceof double[][] d) {
            return d.length > 0 && d[0].length > 0;
        }
        if (kernel instanceof short[][] s) {
            return s.length > 0 && s[0].length > 0;
        }
        if (kernel instanceof int[][] i) {
            return i.length > 0 && i[0].length > 0;
        }
        if (kernel instanceof long[][] l) {
            return l.length > 0 && l[0].length > 0;
        }
        if (kernel instanceof byte[][] b) {
            return b.length > 0 && b[0].length > 0;
        }
        return false;
    }

    private ImageFrame toFrame(final Header header, final Object kernel, final Path file) {
        final var bscale = header.getDoubleValue("BSCALE", 1.0);
        final var bzero = header.getDoubleValue("BZERO", 0.0);
        final Long blank = header.containsKey("BLANK") ? header.getLongValue("BLANK") : null;

        final var data = toFloatGrid(kernel, bscale, bzero, blank);

        var exposure = header.getDoubleValue("EXPTIME", 0.0);
        if (exposure == 0.0) {
            exposure = header.getDoubleValue("EXPOSURE", 0.0);
        }

        final var instrument = firstString(header, "INSTRUME", "TELESCOP");
        final var detector = header.getStringValue("DETECTOR");

        return new ImageFrame(data,
                observationTime(header, file),
                exposure,
                instrument == null ? "UNKNOWN" : instrument.trim(),
                band(header, detector),
                detector == null ? null : detector.trim(),
                geometry(header),
                file.getFileName().toString(),
                false);
    }

    private static int band(final Header header, final String detector) {
        if (header.containsKey("WAVELNTH")) {
            return (int) Math.round(header.getDoubleValue("WAVELNTH"));
        }
        if (detector != null) {
            final var digits = detector.replaceAll("\\D", "");
            if (!digits.isEmpty()) {
                return Integer.parseInt(digits);
            }
        }
        return 0;
    }

    private static FrameGeometry geometry(final Header header) {
        Double rotation = optionalDouble(header, "CROTA2");
        if (rotation == null && header.containsKey("PC1_1") && header.containsKey("PC2_1")) {
            rotation = FastMath.toDegrees(FastMath.atan2(header.getDoubleValue("PC2_1"), header.getDoubleValue("PC1_1")));
        }
        return new FrameGeometry(
                optionalDouble(header, "CDELT1"),
                optionalDouble(header, "CDELT2"),
                optionalDouble(header, "CRPIX1"),
                optionalDouble(header, "CRPIX2"),
                rotation,
                optionalDouble(header, "RSUN_OBS"));
    }

    private static Instant observationTime(final Header header, final Path file) {
        for (final var key : TIME_KEYS) {
            final var value = header.getStringValue(key);
            if (value == null || value.isBlank()) {
                continue;
            }
            try {
                return parseTimestamp(value.trim(), header.getStringValue("TIME-OBS"));
            } catch (final DateTimeParseException e) {
                log.debug("Unparseable {}='{}' in {}", key, value, file.getFileName());
            }
        }
        try {
            final var modified = Files.getLastModifiedTime(file).toInstant();
            log.debug("No observation time in {}, using file modification time {}", file.getFileName(), modified);
            return modified;
        } catch (final IOException e) {
            log.debug("No observation time in {} and no modification time: {}", file.getFileName(), e.getMessage());
            return Instant.EPOCH;
        }
    }

    static Instant parseTimestamp(final String value, final String separateTime) {
        var text = value.replace('/', '-');
        if (text.endsWith("Z")) {
            text = text.substring(0, text.length() - 1);
        }
        if (text.contains("T")) {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        }
        final var day = LocalDate.parse(text);
        if (separateTime != null && !separateTime.isBlank()) {
            return day.atTime(LocalTime.parse(separateTime.trim())).toInstant(ZoneOffset.UTC);
        }
        return day.atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    private static String firstString(final Header header, final String... keys) {
        for (final var key : keys) {
            final var value = header.getStringValue(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static Double optionalDouble(final Header header, final String key) {
        return header.containsKey(key) ? header.getDoubleValue(key) : null;
    }

    static float[][] toFloatGrid(final Object kernel, final double bscale, final double bzero, final Long blank) {
        final var scaled = bscale != 1.0 || bzero != 0.0;
        if (kernel instanceof float[][] f) {
            final var out = new float[f.length][];
            for (int y = 0; y < f.length; y++) {
                out[y] = new float[f[y].length];
                for (int x = 0; x < f[y].length; x++) {
                    out[y][x] = scaled ? (float) (f[y][x] * bscale + bzero) : f[y][x];
                }
            }
            return out;
        }
        if (kernel instanceof double[][] d) {
            final var out = new float[d.length][];
            for (int y = 0; y < d.length; y++) {
                out[y] = new float[d[y].length];
                for (int x = 0; x < d[y].length; x++) {
                    out[y][x] = (float) (d[y][x] * bscale + bzero);
                }
            }
            return out;
        }
        if (kernel instanceof short[][] s) {
            final var out = new float[s.length][];
            for (int y = 0; y < s.length; y++) {
                out[y] = new float[s[y].length];
                for (int x = 0; x < s[y].length; x++) {
                    out[y][x] = integerSample(s[y][x], bscale, bzero, blank);
                }
            }
            return out;
        }
        if (kernel instanceof int[][] i) {
            final var out = new float[i.length][];
            for (int y = 0; y < i.length; y++) {
                out[y] = new float[i[y].length];
                for (int x = 0; x < i[y].length; x++) {
                    out[y][x] = integerSample(i[y][x], bscale, bzero, blank);
                }
            }
            return out;
        }
        if (kernel instanceof long[][] l) {
            final var out = new float[l.length][];
            for (int y = 0; y < l.length; y++) {
                out[y] = new float[l[y].length];
                for (int x = 0; x < l[y].length; x++) {
                    out[y][x] = integerSample(l[y][x], bscale, bzero, blank);
                }
            }
            return out;
        }
        if (kernel instanceof byte[][] b) {
            final var out = new float[b.length][];
            for (int y = 0; y < b.length; y++) {
                out[y] = new float[b[y].length];
                for (int x = 0; x < b[y].length; x++) {
                    // FITS bytes are unsigned
                    out[y][x] = integerSample(b[y][x] & 0xFF, bscale, bzero, blank);
                }
            }
            return out;
        }
        throw new IllegalArgumentException("Unsupported FITS pixel type " + kernel.getClass().getSimpleName());
    }

    private static float integerSample(final long raw, final double bscale, final double bzero, final Long blank) {
        if (blank != null && raw == blank) {
            return Float.NaN;
        }
        return (float) (raw * bscale + bzero);
    }
}
