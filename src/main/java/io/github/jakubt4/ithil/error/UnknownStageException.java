package io.github.jakubt4.ithil.error;

import lombok.Getter;

import java.util.List;

@Getter
public class UnknownStageException extends ReductionException {

    private final String stageName;

    public UnknownStageException(final String stageName, final List<String> knownStages) {
        super("Unknown stage '" + stageName + "', expected one of " + knownStages);
        this.stageName = stageName;
    }
}
