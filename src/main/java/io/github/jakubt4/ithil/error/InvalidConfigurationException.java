package io.github.jakubt4.ithil.error;

import lombok.Getter;

import java.util.List;

@Getter
public class InvalidConfigurationException extends ReductionException {

    private final List<String> problems;

    public InvalidConfigurationException(final List<String> problems) {
        super("Invalid reduction configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
