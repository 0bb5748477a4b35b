package io.github.jakubt4.ithil.config;

import io.github.jakubt4.ithil.model.Image;
import io.github.jakubt4.ithil.stage.StageDescriptor;
import io.github.jakubt4.ithil.stage.StageRegistry;
import io.github.jakubt4.ithil.stage.calibration.CalibrationKernel;
import io.github.jakubt4.ithil.stage.calibration.CalibrationStage;
import io.github.jakubt4.ithil.stage.calibration.SourceTree;
import io.github.jakubt4.ithil.stage.calibration.StageDefinition;
import io.github.jakubt4.ithil.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Registers the reduction stages in pipeline order:
 * ingest, make_bias, subtract_bias, trim, make_dark, subtract_dark,
 * make_flat, divide_flat, solve_wcs, make_catalog.
 */
@Slf4j
@Configuration
public class PipelineConfig {

    public static final String INGEST = "ingest";
    public static final String MAKE_BIAS = "make_bias";
    public static final String SUBTRACT_BIAS = "subtract_bias";
    public static final String TRIM = "trim";
    public static final String MAKE_DARK = "make_dark";
    public static final String SUBTRACT_DARK = "subtract_dark";
    public static final String MAKE_FLAT = "make_flat";
    public static final String DIVIDE_FLAT = "divide_flat";
    public static final String SOLVE_WCS = "solve_wcs";
    public static final String MAKE_CATALOG = "make_catalog";

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    StageRegistry stageRegistry(final MetadataStore metadataStore, final CalibrationKernel kernel) {
        final var registry = new StageRegistry(List.of(
                stage(StageDefinition.perFrame(INGEST, SourceTree.RAW,
                        Image.BIAS, Image.DARK, Image.SKYFLAT, Image.EXPOSE), metadataStore, kernel),
                stage(StageDefinition.master(MAKE_BIAS, "bias", false, Image.BIAS), metadataStore, kernel,
                        INGEST),
                stage(StageDefinition.calibrateWith(SUBTRACT_BIAS, "bias", false,
                        Image.DARK, Image.SKYFLAT, Image.EXPOSE), metadataStore, kernel, INGEST, MAKE_BIAS),
                stage(StageDefinition.perFrame(TRIM, SourceTree.PROCESSED,
                        Image.DARK, Image.SKYFLAT, Image.EXPOSE), metadataStore, kernel, INGEST),
                stage(StageDefinition.master(MAKE_DARK, "dark", false, Image.DARK), metadataStore, kernel,
                        INGEST, SUBTRACT_BIAS),
                stage(StageDefinition.calibrateWith(SUBTRACT_DARK, "dark", false,
                        Image.SKYFLAT, Image.EXPOSE), metadataStore, kernel, INGEST, MAKE_DARK),
                stage(StageDefinition.master(MAKE_FLAT, "flat", true, Image.SKYFLAT), metadataStore, kernel,
                        INGEST, SUBTRACT_DARK),
                stage(StageDefinition.calibrateWith(DIVIDE_FLAT, "flat", true, Image.EXPOSE),
                        metadataStore, kernel, INGEST, MAKE_FLAT),
                stage(StageDefinition.perFrame(SOLVE_WCS, SourceTree.PROCESSED, Image.EXPOSE),
                        metadataStore, kernel, INGEST),
                stage(StageDefinition.perFrame(MAKE_CATALOG, SourceTree.PROCESSED, Image.EXPOSE),
                        metadataStore, kernel, INGEST, SOLVE_WCS)));
        log.info("Registered {} reduction stages: {}", registry.names().size(), registry.names());
        return registry;
    }

    private static StageDescriptor stage(final StageDefinition definition,
                                         final MetadataStore metadataStore,
                                         final CalibrationKernel kernel,
                                         final String... prerequisites) {
        return StageDescriptor.of(definition.name(),
                settings -> new CalibrationStage(definition, settings, metadataStore, kernel),
                prerequisites);
    }
}
