package io.github.jakubt4.ithil.stage.calibration;

import java.util.List;
import java.util.Objects;

/**
 * Declarative description of a calibration stage.
 *
 * @param name          stage name
 * @param mode          per-frame transformation or master combination
 * @param imageTypes    image types the stage consumes
 * @param source        tree the input frames are read from
 * @param product       master product written by a {@link StageMode#MASTER} stage, otherwise {@code null}
 * @param master        master product a per-frame stage calibrates against, or {@code null}
 * @param splitByFilter whether masters are kept per filter as well as per binning
 */
public record StageDefinition(String name,
                              StageMode mode,
                              List<String> imageTypes,
                              SourceTree source,
                              String product,
                              String master,
                              boolean splitByFilter) {

    public StageDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(source, "source");
        imageTypes = List.copyOf(imageTypes);
        if (imageTypes.isEmpty()) {
            throw new IllegalArgumentException("Stage '" + name + "' consumes no image types");
        }
        if (mode == StageMode.MASTER && product == null) {
            throw new IllegalArgumentException("Master stage '" + name + "' needs a product name");
        }
    }

    public static StageDefinition perFrame(final String name, final SourceTree source, final String... imageTypes) {
        return new StageDefinition(name, StageMode.PER_FRAME, List.of(imageTypes), source, null, null, false);
    }

    public static StageDefinition calibrateWith(final String name,
                                                final String master,
                                                final boolean splitByFilter,
                                                final String... imageTypes) {
        return new StageDefinition(name, StageMode.PER_FRAME, List.of(imageTypes), SourceTree.PROCESSED,
                null, master, splitByFilter);
    }

    public static StageDefinition master(final String name,
                                         final String product,
                                         final boolean splitByFilter,
                                         final String imageType) {
        return new StageDefinition(name, StageMode.MASTER, List.of(imageType), SourceTree.PROCESSED,
                product, null, splitByFilter);
    }
}
