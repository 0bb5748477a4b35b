package io.github.jakubt4.ithil.orchestration;

import io.github.jakubt4.ithil.epoch.EpochExpander;
import io.github.jakubt4.ithil.error.StageExecutionException;
import io.github.jakubt4.ithil.model.Telescope;
import io.github.jakubt4.ithil.orchestration.ReductionReport.StageOutcome;
import io.github.jakubt4.ithil.selection.PredicateBuilder;
import io.github.jakubt4.ithil.stage.StageDescriptor;
import io.github.jakubt4.ithil.stage.StageFailedException;
import io.github.jakubt4.ithil.stage.StageRegistry;
import io.github.jakubt4.ithil.stage.StageSettings;
import io.github.jakubt4.ithil.store.MetadataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives one reduction run.
 *
 * <p>Resolves the nights, the telescope and image predicates, the telescope set
 * and the stage subset, then runs each selected stage to completion in registry
 * order on the calling thread. The first stage failure aborts the run: later
 * stages are never constructed and earlier ones are not rolled back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReductionOrchestrator {

    static final String STAGE_MDC_KEY = "stageName";

    private final EpochExpander epochExpander;
    private final PredicateBuilder predicateBuilder;
    private final MetadataStore metadataStore;
    private final StageRegistry stageRegistry;

    /**
     * @throws io.github.jakubt4.ithil.error.InvalidEpochException      before the store is queried
     * @throws io.github.jakubt4.ithil.error.StoreUnavailableException  if the telescope query fails
     * @throws io.github.jakubt4.ithil.error.UnknownStageException      for an unknown stage in the range
     * @throws io.github.jakubt4.ithil.error.InvalidRangeException      for an inverted or malformed range
     * @throws StageExecutionException                                 when a stage fails
     */
    public ReductionReport run(final ReductionRequest request) {
        final var epochs = epochExpander.expand(request.epoch());
        final var predicates = predicateBuilder.build(request.criteria());

        final var telescopes = List.copyOf(metadataStore.queryTelescopes(predicates.telescopes()));
        if (telescopes.isEmpty()) {
            log.warn("No telescopes match [{}], stages will have no work", predicates.telescopes());
        }

        final var stages = stageRegistry.select(request.stageRange());
        if (request.enforcePrerequisites()) {
            stageRegistry.verifyPrerequisites(stages);
        }

        log.info("Reducing {} night(s) [{} .. {}] for {} telescope(s) through {} stage(s): {}",
                epochs.size(), epochs.get(0), epochs.get(epochs.size() - 1), telescopes.size(),
                stages.size(), stages.stream().map(StageDescriptor::name).toList());
        log.debug("Image selection [{}], workers={}", predicates.images(), request.workers());

        final var settings = new StageSettings(request.rawPath(), request.processedPath(),
                predicates.images(), request.workers());
        final var outcomes = new ArrayList<StageOutcome>();
        for (final var stage : stages) {
            outcomes.add(runStage(stage, settings, epochs, telescopes));
        }

        return new ReductionReport(epochs, telescopes.stream().map(Telescope::telescopeId).toList(), outcomes);
    }

    private StageOutcome runStage(final StageDescriptor stage,
                                  final StageSettings settings,
                                  final List<LocalDate> epochs,
                                  final List<Telescope> telescopes) {
        MDC.put(STAGE_MDC_KEY, stage.name());
        final var started = System.nanoTime();
        try {
            log.info("Stage [{}] starting", stage.name());
            final var processor = stage.factory().create(settings);
            processor.run(epochs, telescopes);

            final var elapsed = Duration.ofNanos(System.nanoTime() - started);
            log.info("Stage [{}] completed in {} ms", stage.name(), elapsed.toMillis());
            return new StageOutcome(stage.name(), elapsed);
        } catch (final StageFailedException | RuntimeException e) {
            log.error("Stage [{}] failed, aborting run: {}", stage.name(), e.getMessage());
            throw new StageExecutionException(stage.name(), e);
        } finally {
            MDC.remove(STAGE_MDC_KEY);
        }
    }
}
