package io.github.jakubt4.ithil.config;

import io.github.jakubt4.ithil.error.InvalidConfigurationException;
import io.github.jakubt4.ithil.model.Image;
import io.github.jakubt4.ithil.orchestration.ReductionRequest;
import io.github.jakubt4.ithil.selection.Binning;
import io.github.jakubt4.ithil.selection.SelectionCriteria;
import io.github.jakubt4.ithil.stage.StageRegistry;
import io.github.jakubt4.ithil.store.MetadataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks {@link ReductionProperties} against the telescopes the store knows
 * about and the fixed filter, binning and image type choices, then freezes
 * them into a {@link ReductionRequest}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReductionRequestFactory {

    static final List<String> FILTERS = List.of(
            "sloan", "landolt", "apass", "up", "gp", "rp", "ip", "zs", "U", "B", "V", "R", "I");

    private final MetadataStore metadataStore;
    private final StageRegistry stageRegistry;

    /**
     * @throws InvalidConfigurationException listing every value outside its allowed choices
     * @throws io.github.jakubt4.ithil.error.UnknownStageException for an unknown stage
     * @throws io.github.jakubt4.ithil.error.InvalidRangeException for a malformed stage range
     */
    public ReductionRequest create(final ReductionProperties properties) {
        final var inventory = metadataStore.queryDistinctTelescopeFields();
        log.debug("Known telescopes: sites={}, instruments={}, telescopes={}, camera types={}",
                inventory.sites(), inventory.instruments(), inventory.telescopeIds(), inventory.cameraTypes());

        final var problems = new ArrayList<String>();
        checkChoice(problems, "site", properties.site(), inventory.sites());
        checkChoice(problems, "instrument", properties.instrument(), inventory.instruments());
        checkChoice(problems, "telescope", properties.telescope(), inventory.telescopeIds());
        checkChoice(problems, "camera-type", properties.cameraType(), inventory.cameraTypes());
        checkChoice(problems, "filter", properties.filter(), FILTERS);
        checkChoice(problems, "binning", properties.binning(), Binning.SUPPORTED);
        checkChoice(problems, "image-type", properties.imageType(), Image.TYPES);
        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException(problems);
        }

        stageRegistry.select(properties.stage());

        return ReductionRequest.builder()
                .epoch(properties.epoch())
                .criteria(SelectionCriteria.builder()
                        .site(properties.site())
                        .instrument(properties.instrument())
                        .telescopeId(properties.telescope())
                        .cameraType(properties.cameraType())
                        .filterName(properties.filter())
                        .binning(properties.binning())
                        .imageType(properties.imageType())
                        .build())
                .stageRange(properties.stage())
                .rawPath(properties.rawPath())
                .processedPath(properties.processedPath())
                .workers(properties.workers())
                .enforcePrerequisites(properties.enforcePrerequisites())
                .build();
    }

    private static void checkChoice(final List<String> problems,
                                    final String option,
                                    final String value,
                                    final List<String> choices) {
        if (value == null || value.isBlank()) {
            return;
        }
        if (!choices.contains(value.trim())) {
            problems.add(option + " '" + value + "' is not one of " + choices);
        }
    }
}
