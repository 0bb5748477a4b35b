package io.github.jakubt4.ithil.stage;

import java.util.Objects;
import java.util.Set;

/**
 * A registered stage.
 *
 * @param name          unique stage name, must not contain {@code '-'}
 * @param factory       builds the stage's processor for a run
 * @param prerequisites stages whose products this stage reads
 */
public record StageDescriptor(String name, StageFactory factory, Set<String> prerequisites) {

    public StageDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(factory, "factory");
        if (name.isBlank() || name.contains(StageRegistry.RANGE_SEPARATOR)) {
            throw new IllegalArgumentException("Illegal stage name '" + name + "'");
        }
        prerequisites = Set.copyOf(prerequisites);
    }

    public static StageDescriptor of(final String name, final StageFactory factory, final String... prerequisites) {
        return new StageDescriptor(name, factory, Set.of(prerequisites));
    }
}
