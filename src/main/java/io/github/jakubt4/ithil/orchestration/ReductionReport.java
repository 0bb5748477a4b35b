package io.github.jakubt4.ithil.orchestration;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of a completed reduction run.
 */
public record ReductionReport(List<LocalDate> epochs, List<String> telescopeIds, List<StageOutcome> stages) {

    public record StageOutcome(String stageName, Duration elapsed) {
    }

    public ReductionReport {
        epochs = List.copyOf(epochs);
        telescopeIds = List.copyOf(telescopeIds);
        stages = List.copyOf(stages);
    }

    public List<String> completedStages() {
        return stages.stream().map(StageOutcome::stageName).toList();
    }
}
