package io.github.jakubt4.ithil.stage.calibration;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Pixel-level operations behind the calibration stages. Implementations must be
 * safe to call from several stage workers at once.
 */
public interface CalibrationKernel {

    /**
     * Combines the frames of one night, binning and (optionally) filter into a master.
     */
    void combine(String stage, List<Path> frames, Path master) throws IOException;

    /**
     * Transforms a single frame, calibrating it against {@code master} when present.
     * {@code frame} and {@code output} may be the same file.
     */
    void apply(String stage, Path frame, Optional<Path> master, Path output) throws IOException;
}
