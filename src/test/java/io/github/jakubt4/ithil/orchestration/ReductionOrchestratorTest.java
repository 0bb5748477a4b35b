package io.github.jakubt4.ithil.orchestration;

import io.github.jakubt4.ithil.epoch.EpochExpander;
import io.github.jakubt4.ithil.error.InvalidConfigurationException;
import io.github.jakubt4.ithil.error.InvalidEpochException;
import io.github.jakubt4.ithil.error.InvalidRangeException;
import io.github.jakubt4.ithil.error.StageExecutionException;
import io.github.jakubt4.ithil.error.StoreUnavailableException;
import io.github.jakubt4.ithil.error.UnknownStageException;
import io.github.jakubt4.ithil.model.Telescope;
import io.github.jakubt4.ithil.selection.FieldPredicate;
import io.github.jakubt4.ithil.selection.ImageField;
import io.github.jakubt4.ithil.selection.PredicateBuilder;
import io.github.jakubt4.ithil.selection.SelectionCriteria;
import io.github.jakubt4.ithil.selection.TelescopeField;
import io.github.jakubt4.ithil.stage.StageDescriptor;
import io.github.jakubt4.ithil.stage.StageFailedException;
import io.github.jakubt4.ithil.stage.StageRegistry;
import io.github.jakubt4.ithil.stage.StageSettings;
import io.github.jakubt4.ithil.store.MetadataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReductionOrchestratorTest {

    private static final LocalDate NIGHT = LocalDate.of(2015, 10, 1);
    private static final Telescope LSC_009 = new Telescope("1m0-009", "lsc", "kb78", "SBig");
    private static final Telescope LSC_005 = new Telescope("1m0-005", "lsc", "fl04", "Sinistro");

    /**
     * Records construction and invocation of every stage it registers.
     */
    private static final class Recorder {

        final List<String> constructed = new ArrayList<>();
        final List<String> invoked = new ArrayList<>();
        final List<StageSettings> settings = new ArrayList<>();
        final List<List<LocalDate>> epochs = new ArrayList<>();
        final List<List<Telescope>> telescopes = new ArrayList<>();
        final List<String> stageNamesInMdc = new ArrayList<>();
        String failing;

        StageDescriptor stage(final String name) {
            return StageDescriptor.of(name, stageSettings -> {
                constructed.add(name);
                settings.add(stageSettings);
                return (runEpochs, runTelescopes) -> {
                    invoked.add(name);
                    epochs.add(runEpochs);
                    telescopes.add(runTelescopes);
                    stageNamesInMdc.add(MDC.get("stageName"));
                    if (name.equals(failing)) {
                        throw new StageFailedException(name, List.of("1m0-009/20151001"));
                    }
                };
            });
        }
    }

    private final Recorder recorder = new Recorder();
    private final MetadataStore metadataStore = mock(MetadataStore.class);

    private ReductionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        final var registry = new StageRegistry(List.of(
                recorder.stage("ingest"),
                recorder.stage("make_bias"),
                recorder.stage("subtract_bias"),
                recorder.stage("trim"),
                StageDescriptor.of("make_dark", recorder.stage("make_dark").factory(), "subtract_bias")));
        final var clock = Clock.fixed(Instant.parse("2015-10-02T12:00:00Z"), ZoneOffset.UTC);
        orchestrator = new ReductionOrchestrator(new EpochExpander(clock), new PredicateBuilder(),
                metadataStore, registry);
        when(metadataStore.queryTelescopes(any())).thenReturn(List.of(LSC_009, LSC_005));
    }

    @Test
    void runsSelectedStagesInRegistryOrderWithResolvedInputs() {
        final var request = request("2015-10-01", "make_bias-subtract_bias")
                .criteria(SelectionCriteria.builder().site("lsc").binning("2x2").build())
                .build();

        final var report = orchestrator.run(request);

        verify(metadataStore).queryTelescopes(FieldPredicate.where(TelescopeField.SITE, "lsc"));
        assertThat(recorder.invoked).containsExactly("make_bias", "subtract_bias");
        assertThat(recorder.epochs).containsOnly(List.of(NIGHT));
        assertThat(recorder.telescopes).containsOnly(List.of(LSC_009, LSC_005));
        assertThat(recorder.settings).allSatisfy(settings -> {
            assertThat(settings.imagePredicate()).isEqualTo(FieldPredicate.where(ImageField.CCDSUM, "2 2"));
            assertThat(settings.rawPath()).isEqualTo(Path.of("/raw"));
            assertThat(settings.processedPath()).isEqualTo(Path.of("/processed"));
            assertThat(settings.workers()).isEqualTo(3);
        });

        assertThat(report.completedStages()).containsExactly("make_bias", "subtract_bias");
        assertThat(report.epochs()).containsExactly(NIGHT);
        assertThat(report.telescopeIds()).containsExactly("1m0-009", "1m0-005");
    }

    @Test
    void blankRangeRunsTheWholePipeline() {
        final var report = orchestrator.run(request("20151001-20151003", "").build());

        assertThat(recorder.invoked).containsExactly("ingest", "make_bias", "subtract_bias", "trim", "make_dark");
        assertThat(recorder.epochs).allSatisfy(epochs -> assertThat(epochs).hasSize(3));
        assertThat(report.stages()).allSatisfy(outcome -> assertThat(outcome.elapsed().isNegative()).isFalse());
    }

    @Test
    void failingStageAbortsTheRemainingStages() {
        recorder.failing = "subtract_bias";

        assertThatThrownBy(() -> orchestrator.run(request("20151001", "ingest-make_dark").build()))
                .isInstanceOf(StageExecutionException.class)
                .hasMessageContaining("Stage [subtract_bias] failed")
                .hasCauseInstanceOf(StageFailedException.class)
                .isInstanceOfSatisfying(StageExecutionException.class,
                        e -> assertThat(e.getStageName()).isEqualTo("subtract_bias"));

        assertThat(recorder.invoked).containsExactly("ingest", "make_bias", "subtract_bias");
        assertThat(recorder.constructed).containsExactly("ingest", "make_bias", "subtract_bias");
    }

    @Test
    void runtimeFailureDuringConstructionIsWrappedWithTheStageName() {
        final var registry = new StageRegistry(List.of(
                recorder.stage("ingest"),
                StageDescriptor.of("make_bias", settings -> {
                    throw new IllegalStateException("no bias kernel");
                }),
                recorder.stage("subtract_bias")));
        final var failing = new ReductionOrchestrator(new EpochExpander(Clock.systemUTC()),
                new PredicateBuilder(), metadataStore, registry);

        assertThatThrownBy(() -> failing.run(request("20151001", "").build()))
                .isInstanceOf(StageExecutionException.class)
                .hasRootCauseMessage("no bias kernel");
        assertThat(recorder.invoked).containsExactly("ingest");
    }

    @Test
    void stageNameIsInTheMdcOnlyWhileTheStageRuns() {
        recorder.failing = "make_bias";

        assertThatThrownBy(() -> orchestrator.run(request("20151001", "ingest-trim").build()))
                .isInstanceOf(StageExecutionException.class);

        assertThat(recorder.stageNamesInMdc).containsExactly("ingest", "make_bias");
        assertThat(MDC.get("stageName")).isNull();
    }

    @Test
    void invalidEpochFailsBeforeTheStoreIsQueried() {
        assertThatThrownBy(() -> orchestrator.run(request("20151005-20151001", "").build()))
                .isInstanceOf(InvalidEpochException.class);

        verify(metadataStore, never()).queryTelescopes(any());
        assertThat(recorder.constructed).isEmpty();
    }

    @Test
    void unavailableStoreStopsTheRunBeforeAnyStage() {
        when(metadataStore.queryTelescopes(any())).thenThrow(
                new StoreUnavailableException("telescope query", new DataAccessResourceFailureException("down")));

        assertThatThrownBy(() -> orchestrator.run(request("20151001", "").build()))
                .isInstanceOf(StoreUnavailableException.class);
        assertThat(recorder.constructed).isEmpty();
    }

    @Test
    void badStageRangeFailsBeforeDispatch() {
        assertThatThrownBy(() -> orchestrator.run(request("20151001", "trim-make_bias").build()))
                .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> orchestrator.run(request("20151001", "make_sky").build()))
                .isInstanceOf(UnknownStageException.class);

        assertThat(recorder.constructed).isEmpty();
    }

    @Test
    void emptyTelescopeSetStillRunsStagesWithNoWork() {
        when(metadataStore.queryTelescopes(any())).thenReturn(List.of());

        final var report = orchestrator.run(request("20151001", "ingest").build());

        assertThat(recorder.telescopes).containsExactly(List.of());
        assertThat(report.telescopeIds()).isEmpty();
        assertThat(report.completedStages()).containsExactly("ingest");
    }

    @Test
    void prerequisiteEnforcementRejectsSkippingRanges() {
        final var request = request("20151001", "make_dark").enforcePrerequisites(true).build();

        assertThatThrownBy(() -> orchestrator.run(request))
                .isInstanceOf(InvalidRangeException.class)
                .hasMessageContaining("make_dark requires subtract_bias");
        assertThat(recorder.constructed).isEmpty();
    }

    @Test
    void prerequisitesAreIgnoredUnlessEnforced() {
        orchestrator.run(request("20151001", "make_dark").build());

        assertThat(recorder.invoked).containsExactly("make_dark");
    }

    @Test
    void unsetWorkerCountDefaultsToOne() {
        final var request = ReductionRequest.builder()
                .epoch("20151001")
                .stageRange("ingest")
                .rawPath(Path.of("/raw"))
                .processedPath(Path.of("/processed"))
                .build();

        orchestrator.run(request);

        assertThat(request.workers()).isEqualTo(1);
        assertThat(recorder.settings).singleElement().extracting(StageSettings::workers).isEqualTo(1);
    }

    @Test
    void negativeWorkerCountIsAConfigurationError() {
        assertThatThrownBy(() -> request("20151001", "ingest").workers(-2).build())
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("workers must be at least 1, got -2");
    }

    @Test
    void stagesShareTheSameImmutableInputs() {
        orchestrator.run(request("20151001", "ingest-make_bias").build());

        assertThat(Set.copyOf(recorder.telescopes)).hasSize(1);
        assertThat(recorder.telescopes.get(0)).isUnmodifiable();
        assertThat(recorder.epochs.get(0)).isUnmodifiable();
    }

    private static ReductionRequest.ReductionRequestBuilder request(final String epoch, final String stageRange) {
        return ReductionRequest.builder()
                .epoch(epoch)
                .stageRange(stageRange)
                .rawPath(Path.of("/raw"))
                .processedPath(Path.of("/processed"))
                .workers(3);
    }
}
