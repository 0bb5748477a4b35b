package io.github.jakubt4.ithil.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Reduction run configuration, bound from {@code reduction.*} properties or the
 * matching command-line arguments (e.g. {@code --reduction.epoch=20151001
 * --reduction.site=lsc --reduction.stage=make_bias-subtract_bias}).
 *
 * <p>Empty strings mean "no constraint" for every selection filter.
 *
 * @param epoch                night or night range to reduce; the run only starts when this is set
 * @param site                 site code, e.g. {@code elp}
 * @param instrument           instrument code, e.g. {@code kb74}
 * @param telescope            telescope id, e.g. {@code 1m0-010}
 * @param cameraType           camera type, e.g. {@code SBig}
 * @param stage                single stage or {@code start-end} range
 * @param rawPath              top level directory of the raw data
 * @param processedPath        top level directory for processed data
 * @param filter               image filter
 * @param binning              image binning, {@code 1x1} or {@code 2x2}
 * @param imageType            image type to reduce
 * @param workers              number of worker threads each stage may use
 * @param logLevel             verbosity of the application loggers
 * @param enforcePrerequisites reject stage ranges that skip a prerequisite stage
 */
@Validated
@ConfigurationProperties(prefix = "reduction")
public record ReductionProperties(
        String epoch,
        @DefaultValue("") String site,
        @DefaultValue("") String instrument,
        @DefaultValue("") String telescope,
        @DefaultValue("") String cameraType,
        @DefaultValue("") String stage,
        @NotNull @DefaultValue("/archive/engineering") Path rawPath,
        @NotNull @DefaultValue("/nethome/supernova/pylcogt") Path processedPath,
        @DefaultValue("") String filter,
        @DefaultValue("") String binning,
        @DefaultValue("") String imageType,
        @Min(1) @DefaultValue("1") int workers,
        @Pattern(regexp = "debug|info|warning|error|critical|fatal")
        @DefaultValue("info") String logLevel,
        @DefaultValue("false") boolean enforcePrerequisites) {
}
