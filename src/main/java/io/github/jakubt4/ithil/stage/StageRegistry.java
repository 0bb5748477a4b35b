package io.github.jakubt4.ithil.stage;

import io.github.jakubt4.ithil.error.InvalidRangeException;
import io.github.jakubt4.ithil.error.UnknownStageException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, ordered set of pipeline stages.
 *
 * <p>Registration order is pipeline order. It encodes the dependency chain
 * between stages (bias products exist before bias subtraction runs, and so on)
 * but is not checked against it unless {@link #verifyPrerequisites} is called.
 */
public final class StageRegistry {

    static final String RANGE_SEPARATOR = "-";

    private final List<StageDescriptor> stages;
    private final Map<String, Integer> positions;

    /**
     * @throws IllegalArgumentException on duplicate names, or a prerequisite that
     *                                  is not registered before the stage needing it
     */
    public StageRegistry(final List<StageDescriptor> stages) {
        final var index = new HashMap<String, Integer>();
        for (var i = 0; i < stages.size(); i++) {
            final var stage = stages.get(i);
            if (index.putIfAbsent(stage.name(), i) != null) {
                throw new IllegalArgumentException("Stage '" + stage.name() + "' registered twice");
            }
            for (final var prerequisite : stage.prerequisites()) {
                if (!index.containsKey(prerequisite) || prerequisite.equals(stage.name())) {
                    throw new IllegalArgumentException("Stage '" + stage.name() + "' requires '"
                            + prerequisite + "', which is not registered before it");
                }
            }
        }
        this.stages = List.copyOf(stages);
        this.positions = Map.copyOf(index);
    }

    public List<String> names() {
        return stages.stream().map(StageDescriptor::name).toList();
    }

    public List<StageDescriptor> stages() {
        return stages;
    }

    public boolean contains(final String name) {
        return positions.containsKey(name);
    }

    /**
     * @throws UnknownStageException if no stage has that name
     */
    public StageDescriptor descriptor(final String name) {
        return stages.get(position(name));
    }

    /**
     * Resolves a stage range.
     *
     * <ul>
     *   <li>blank or {@code null}: every stage</li>
     *   <li>{@code "name"}: just that stage</li>
     *   <li>{@code "start-end"}: start through end inclusive, in registry order</li>
     * </ul>
     *
     * @throws UnknownStageException if a named stage is not registered
     * @throws InvalidRangeException if start comes after end, or the range is malformed
     */
    public List<StageDescriptor> select(final String rangeSpec) {
        if (rangeSpec == null || rangeSpec.isBlank()) {
            return stages;
        }
        final var bounds = rangeSpec.trim().split(RANGE_SEPARATOR, -1);
        if (bounds.length == 1) {
            return List.of(descriptor(bounds[0]));
        }
        if (bounds.length != 2 || bounds[0].isBlank() || bounds[1].isBlank()) {
            throw new InvalidRangeException(rangeSpec, "expected 'stage' or 'start-end'");
        }
        final var start = position(bounds[0].trim());
        final var end = position(bounds[1].trim());
        if (start > end) {
            throw new InvalidRangeException(rangeSpec,
                    "'" + bounds[0].trim() + "' runs after '" + bounds[1].trim() + "'");
        }
        return stages.subList(start, end + 1);
    }

    /**
     * Rejects a selection that contains a stage without one of its prerequisites.
     *
     * @throws InvalidRangeException naming the first stage whose prerequisite is missing
     */
    public void verifyPrerequisites(final List<StageDescriptor> selection) {
        final var selected = selection.stream().map(StageDescriptor::name).toList();
        final var missing = new ArrayList<String>();
        for (final var stage : selection) {
            stage.prerequisites().stream()
                    .filter(prerequisite -> !selected.contains(prerequisite))
                    .sorted()
                    .map(prerequisite -> stage.name() + " requires " + prerequisite)
                    .forEach(missing::add);
        }
        if (!missing.isEmpty()) {
            throw new InvalidRangeException(describe(selected),
                    "selection skips prerequisites: " + String.join(", ", missing));
        }
    }

    private static String describe(final List<String> selected) {
        if (selected.size() == 1) {
            return selected.get(0);
        }
        return selected.get(0) + RANGE_SEPARATOR + selected.get(selected.size() - 1);
    }

    private int position(final String name) {
        final var position = positions.get(name);
        if (position == null) {
            throw new UnknownStageException(name, names());
        }
        return position;
    }
}
