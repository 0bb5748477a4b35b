package io.github.jakubt4.ithil.stage;

import io.github.jakubt4.ithil.model.Image;
import io.github.jakubt4.ithil.selection.FieldPredicate;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Per-run inputs handed to every stage factory.
 *
 * @param rawPath        root of the raw frame archive
 * @param processedPath  root of the processed data tree
 * @param imagePredicate user image selection, applied on top of the stage's own image types
 * @param workers        upper bound on concurrent units of work inside the stage
 */
public record StageSettings(Path rawPath, Path processedPath, FieldPredicate<Image> imagePredicate, int workers) {

    public StageSettings {
        Objects.requireNonNull(rawPath, "rawPath");
        Objects.requireNonNull(processedPath, "processedPath");
        Objects.requireNonNull(imagePredicate, "imagePredicate");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workers);
        }
    }
}
