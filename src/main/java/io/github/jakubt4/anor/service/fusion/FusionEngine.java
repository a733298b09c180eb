package io.github.jakubt4.anor.service.fusion;

import io.github.jakubt4.anor.model.CompositeImage;
import io.github.jakubt4.anor.model.ImageFrame;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Combines co-registered frames into an exposure-weighted composite.
 */
@Service
public class FusionEngine {

    /**
     * Fuses a complete batch of frames. Source and band of the composite are taken from the
     * first frame; frames whose shape differs from the first are left out.
     *
     * @throws IllegalArgumentException when {@code frames} is empty
     * @throws IllegalStateException    when no frame could be fused
     */
    public CompositeImage fuse(final List<ImageFrame> frames) {
        if (frames == null || frames.isEmpty()) {
            throw new IllegalArgumentException("Nothing to fuse: frame list is empty");
        }
        final var first = frames.get(0);
        final var accumulator = accumulator(first.instrument(), first.band(), first.detector());
        frames.forEach(accumulator::add);
        return accumulator.toComposite();
    }

    /**
     * Opens a streaming accumulation so frames can be fused one at a time as they are
     * calibrated, without holding the whole batch in memory.
     */
    public FusionAccumulator accumulator(final String source, final int band, final String detector) {
        return new FusionAccumulator(source, band, detector);
    }
}
