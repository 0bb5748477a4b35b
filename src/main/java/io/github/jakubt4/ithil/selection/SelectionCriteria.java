package io.github.jakubt4.ithil.selection;

import lombok.Builder;

/**
 * Optional filters restricting a reduction run. A {@code null} or blank value
 * places no constraint on its field; set values combine with AND.
 *
 * @param site        site code
 * @param instrument  instrument code
 * @param telescopeId telescope identifier
 * @param cameraType  camera family
 * @param filterName  image filter
 * @param binning     binning, compact ({@code "2x2"}) or native ({@code "2 2"})
 * @param imageType   image type (BIAS, DARK, SKYFLAT, EXPOSE)
 */
@Builder
public record SelectionCriteria(String site,
                                String instrument,
                                String telescopeId,
                                String cameraType,
                                String filterName,
                                String binning,
                                String imageType) {

    public static SelectionCriteria none() {
        return SelectionCriteria.builder().build();
    }
}
