package io.github.jakubt4.ithil.stage.calibration;

public enum StageMode {
    /** Transforms each selected frame in place in the processed tree. */
    PER_FRAME,
    /** Combines the selected frames of a night into a master calibration product. */
    MASTER
}
