package io.github.jakubt4.ithil.stage.calibration;

public enum SourceTree {
    RAW,
    PROCESSED
}
