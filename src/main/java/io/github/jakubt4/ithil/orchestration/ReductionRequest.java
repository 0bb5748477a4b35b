package io.github.jakubt4.ithil.orchestration;

import io.github.jakubt4.ithil.error.InvalidConfigurationException;
import io.github.jakubt4.ithil.selection.SelectionCriteria;
import lombok.Builder;

import java.nio.file.Path;
import java.util.List;

/**
 * Validated input of a single reduction run.
 *
 * @param epoch                epoch expression, e.g. {@code 20151001} or {@code 20151001-20151005}
 * @param criteria             telescope and image selection
 * @param stageRange           stage range, blank for the whole pipeline
 * @param rawPath              root of the raw frame archive
 * @param processedPath        root of the processed data tree
 * @param workers              worker-count hint passed to every stage; 0 (unset) means 1
 * @param enforcePrerequisites reject stage ranges that skip a prerequisite stage
 */
@Builder
public record ReductionRequest(String epoch,
                               SelectionCriteria criteria,
                               String stageRange,
                               Path rawPath,
                               Path processedPath,
                               int workers,
                               boolean enforcePrerequisites) {

    public ReductionRequest {
        criteria = criteria == null ? SelectionCriteria.none() : criteria;
        if (workers < 0) {
            throw new InvalidConfigurationException(List.of("workers must be at least 1, got " + workers));
        }
        workers = Math.max(workers, 1);
    }
}
