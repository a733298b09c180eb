package io.github.jakubt4.anor.service.fusion;

import io.github.jakubt4.anor.model.CompositeImage;
import io.github.jakubt4.anor.model.FrameGeometry;
import io.github.jakubt4.anor.model.ImageFrame;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.stat.descriptive.DescriptiveStatistics;
import org.hipparchus.util.FastMath;

import java.time.Instant;

/**
 * Running exposure-weighted sum over frames of one shape.
 *
 * <p>Per pixel the composite is {@code Σ(d·w) / Σw} with {@code w = max(exposure, 1e-6)}.
 * Non-finite samples add nothing to the numerator but their frame's weight still counts
 * in the denominator. Not thread-safe; one instance serves one acquisition.
 */
@Slf4j
public class FusionAccumulator {

    static final int MAX_PATCH_SIDE = 64;

    private static final double MIN_WEIGHT_SUM = 1e-6;

    private final String source;
    private final int band;
    private final String detector;

    private int height = -1;
    private int width = -1;
    private double[] weightedSum;
    private double weightSum;
    private int frameCount;
    private Instant earliest;
    private Instant latest;
    private FrameGeometry referenceGeometry;
    private float[][] referencePatch;

    FusionAccumulator(final String source, final int band, final String detector) {
        this.source = source;
        this.band = band;
        this.detector = detector;
    }

    /**
     * Adds one frame.
     *
     * @return {@code false} when the frame was rejected because its shape differs from the
     *         first accepted frame
     */
    public boolean add(final ImageFrame frame) {
        if (frameCount == 0) {
            height = frame.height();
            width = frame.width();
            if (!frame.sameShapeAs(height, width)) {
                log.warn("[FUSE] Ragged grid in {}, frame skipped", frame.origin());
                return false;
            }
            weightedSum = new double[height * width];
            referenceGeometry = frame.geometry();
            referencePatch = centralPatch(frame.data());
        } else if (!frame.sameShapeAs(height, width)) {
            log.warn("[FUSE] Shape mismatch: {} is {}x{}, reference is {}x{}; frame skipped",
                    frame.origin(), frame.width(), frame.height(), width, height);
            return false;
        }

        final var weight = frame.fusionWeight();
        final var data = frame.data();
        for (int y = 0; y < height; y++) {
            final var row = data[y];
            final var offset = y * width;
            for (int x = 0; x < width; x++) {
                final var sample = row[x];
                if (Float.isFinite(sample)) {
                    weightedSum[offset + x] += sample * weight;
                }
            }
        }
        weightSum += weight;
        frameCount++;

        final var observedAt = frame.observedAt();
        earliest = earliest == null || observedAt.isBefore(earliest) ? observedAt : earliest;
        latest = latest == null || observedAt.isAfter(latest) ? observedAt : latest;
        return true;
    }

    public int frameCount() {
        return frameCount;
    }

    /**
     * @throws IllegalStateException when no frame has been accepted
     */
    public CompositeImage toComposite() {
        if (frameCount == 0) {
            throw new IllegalStateException("No frames were fused for " + source + "/" + band);
        }
        final var denominator = FastMath.max(weightSum, MIN_WEIGHT_SUM);
        final var data = new float[height][width];
        for (int y = 0; y < height; y++) {
            final var offset = y * width;
            for (int x = 0; x < width; x++) {
                data[y][x] = (float) (weightedSum[offset + x] / denominator);
            }
        }
        return new CompositeImage(data, source, band, detector, frameCount, earliest, latest,
                referenceGeometry, snrGain(data));
    }

    private Double snrGain(final float[][] composite) {
        try {
            final var referenceStd = standardDeviation(referencePatch);
            final var compositeStd = standardDeviation(centralPatch(composite));
            if (!Double.isFinite(referenceStd) || !Double.isFinite(compositeStd) || compositeStd <= 0.0) {
                return null;
            }
            return referenceStd / compositeStd;
        } catch (final RuntimeException e) {
            log.warn("[FUSE] SNR estimate unavailable for {}/{}: {}", source, band, e.getMessage());
            return null;
        }
    }

    static int patchSide(final int height, final int width) {
        return FastMath.max(1, FastMath.min(MAX_PATCH_SIDE, FastMath.min(height, width) / 2));
    }

    private static float[][] centralPatch(final float[][] data) {
        final var height = data.length;
        final var width = data[0].length;
        final var side = patchSide(height, width);
        final var top = (height - side) / 2;
        final var left = (width - side) / 2;
        final var patch = new float[side][side];
        for (int y = 0; y < side; y++) {
            System.arraycopy(data[top + y], left, patch[y], 0, side);
        }
        return patch;
    }

    private static double standardDeviation(final float[][] patch) {
        final var statistics = new DescriptiveStatistics();
        for (final float[] row : patch) {
            for (final float sample : row) {
                if (Float.isFinite(sample)) {
                    statistics.addValue(sample);
                }
            }
        }
        return statistics.getN() < 2 ? Double.NaN : statistics.getStandardDeviation();
    }
}
