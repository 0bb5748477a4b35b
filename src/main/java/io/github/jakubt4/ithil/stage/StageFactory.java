package io.github.jakubt4.ithil.stage;

@FunctionalInterface
public interface StageFactory {

    StageProcessor create(StageSettings settings);
}
