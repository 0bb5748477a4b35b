package io.github.jakubt4.ithil.stage.calibration;

import io.github.jakubt4.ithil.epoch.EpochExpander;
import io.github.jakubt4.ithil.model.Image;
import io.github.jakubt4.ithil.model.Telescope;
import io.github.jakubt4.ithil.selection.ImageField;
import io.github.jakubt4.ithil.stage.StageFailedException;
import io.github.jakubt4.ithil.stage.StageProcessor;
import io.github.jakubt4.ithil.stage.StageSettings;
import io.github.jakubt4.ithil.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Generic calibration stage driven by a {@link StageDefinition}.
 *
 * <p>The work is split into one unit per (telescope, night). Units run on a
 * fixed pool sized by {@link StageSettings#workers()} and fail independently:
 * a unit that cannot find its input frames or its master is logged and the
 * remaining units still run. The stage reports every failed unit at the end.
 */
@Slf4j
public class CalibrationStage implements StageProcessor {

    private final StageDefinition definition;
    private final StageSettings settings;
    private final MetadataStore metadataStore;
    private final CalibrationKernel kernel;

    public CalibrationStage(final StageDefinition definition,
                            final StageSettings settings,
                            final MetadataStore metadataStore,
                            final CalibrationKernel kernel) {
        this.definition = definition;
        this.settings = settings;
        this.metadataStore = metadataStore;
        this.kernel = kernel;
    }

    private record WorkUnit(Telescope telescope, LocalDate dayObs) {

        @Override
        public String toString() {
            return telescope.telescopeId() + "/" + EpochExpander.dayObs(dayObs);
        }
    }

    private record MasterKey(String ccdsum, String filterName) {
    }

    @Override
    public void run(final List<LocalDate> epochs, final List<Telescope> telescopes) throws StageFailedException {
        final var units = new ArrayList<WorkUnit>();
        for (final var telescope : telescopes) {
            for (final var epoch : epochs) {
                units.add(new WorkUnit(telescope, epoch));
            }
        }
        if (units.isEmpty()) {
            log.info("[{}] Nothing to process", definition.name());
            return;
        }

        final var executor = newExecutor(Math.min(settings.workers(), units.size()));
        final var mdc = MDC.getCopyOfContextMap();
        try {
            final var futures = new LinkedHashMap<WorkUnit, Future<Integer>>();
            for (final var unit : units) {
                futures.put(unit, executor.submit(() -> processWithContext(unit, mdc)));
            }
            awaitAll(futures);
        } finally {
            executor.shutdownNow();
        }
    }

    private void awaitAll(final Map<WorkUnit, Future<Integer>> futures) throws StageFailedException {
        final var failed = new ArrayList<String>();
        var frames = 0;
        for (final var entry : futures.entrySet()) {
            try {
                frames += entry.getValue().get();
            } catch (final ExecutionException e) {
                final var cause = e.getCause();
                log.warn("[{}] Unit {} failed: {}", definition.name(), entry.getKey(), cause.toString());
                failed.add(entry.getKey().toString());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StageFailedException(definition.name(), "Interrupted while waiting for stage workers", e);
            }
        }
        log.info("[{}] Processed {} frame(s) in {} unit(s), {} failed",
                definition.name(), frames, futures.size(), failed.size());
        if (!failed.isEmpty()) {
            throw new StageFailedException(definition.name(), failed);
        }
    }

    private int processWithContext(final WorkUnit unit, final Map<String, String> mdc) throws IOException {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            return process(unit);
        } finally {
            MDC.clear();
        }
    }

    private int process(final WorkUnit unit) throws IOException {
        final var frames = selectFrames(unit);
        if (frames.isEmpty()) {
            log.debug("[{}] No frames for {}", definition.name(), unit);
            return 0;
        }
        log.debug("[{}] {} frame(s) for {}", definition.name(), frames.size(), unit);
        return switch (definition.mode()) {
            case PER_FRAME -> applyEach(unit, frames);
            case MASTER -> combineGroups(unit, frames);
        };
    }

    private List<Image> selectFrames(final WorkUnit unit) {
        final var frames = new ArrayList<Image>();
        for (final var imageType : definition.imageTypes()) {
            final var predicate = settings.imagePredicate().and(ImageField.IMAGE_TYPE, imageType);
            frames.addAll(metadataStore.queryImages(predicate, unit.telescope(), unit.dayObs()));
        }
        frames.sort(Comparator.comparing(Image::dateObs, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
                .thenComparingLong(Image::id));
        return frames;
    }

    private int applyEach(final WorkUnit unit, final List<Image> frames) throws IOException {
        for (final var image : frames) {
            final var input = requireFrame(unit.telescope(), image);
            final var master = definition.master() == null
                    ? Optional.<Path>empty()
                    : Optional.of(requireMaster(unit, image));
            final var output = FrameLayout.frame(settings.processedPath(), unit.telescope(), image);
            kernel.apply(definition.name(), input, master, output);
        }
        return frames.size();
    }

    private int combineGroups(final WorkUnit unit, final List<Image> frames) throws IOException {
        final Map<MasterKey, List<Image>> groups = frames.stream()
                .collect(Collectors.groupingBy(this::masterKey, LinkedHashMap::new, Collectors.toList()));
        for (final var group : groups.entrySet()) {
            final var inputs = new ArrayList<Path>();
            for (final var image : group.getValue()) {
                inputs.add(requireFrame(unit.telescope(), image));
            }
            final var output = FrameLayout.master(settings.processedPath(), unit.telescope(), unit.dayObs(),
                    definition.product(), group.getKey().ccdsum(), group.getKey().filterName());
            kernel.combine(definition.name(), inputs, output);
            log.info("[{}] Master {} built from {} frame(s)", definition.name(), output.getFileName(), inputs.size());
        }
        return frames.size();
    }

    private MasterKey masterKey(final Image image) {
        return new MasterKey(image.ccdsum(), definition.splitByFilter() ? image.filterName() : null);
    }

    private Path requireFrame(final Telescope telescope, final Image image) throws NoSuchFileException {
        final var root = definition.source() == SourceTree.RAW ? settings.rawPath() : settings.processedPath();
        final var path = FrameLayout.frame(root, telescope, image);
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString(), null, "frame " + image.filename() + " not found");
        }
        return path;
    }

    private Path requireMaster(final WorkUnit unit, final Image image) throws FileNotFoundException {
        final var path = FrameLayout.master(settings.processedPath(), unit.telescope(), image.dayObs(),
                definition.master(), image.ccdsum(), definition.splitByFilter() ? image.filterName() : null);
        if (!Files.isRegularFile(path)) {
            throw new FileNotFoundException("No master " + definition.master() + " for " + image.filename()
                    + " (expected " + path + ")");
        }
        return path;
    }

    private ExecutorService newExecutor(final int threads) {
        final var threadFactory = new CustomizableThreadFactory(definition.name() + "-worker-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}
