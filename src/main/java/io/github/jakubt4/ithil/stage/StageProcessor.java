package io.github.jakubt4.ithil.stage;

import io.github.jakubt4.ithil.model.Telescope;

import java.time.LocalDate;
import java.util.List;

/**
 * One pipeline stage bound to the paths and image predicate of a run.
 *
 * <p>A processor owns its internal concurrency and decides which of its units
 * of work can fail independently. The epoch and telescope lists it receives
 * are shared with other stages and must not be modified.
 */
public interface StageProcessor {

    /**
     * Runs the stage over every telescope for every night.
     *
     * @throws StageFailedException if the stage could not complete its work
     */
    void run(List<LocalDate> epochs, List<Telescope> telescopes) throws StageFailedException;
}
