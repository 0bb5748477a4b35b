package io.github.jakubt4.ithil.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Metadata of a single raw frame.
 *
 * @param id          store key
 * @param filename    frame file name, relative to its night directory
 * @param filterName  filter in the beam (e.g. "rp")
 * @param ccdsum      binning in the store's native form (e.g. "2 2")
 * @param imageType   one of {@link #TYPES}
 * @param dateObs     shutter-open timestamp
 * @param dayObs      observing night the frame belongs to
 * @param telescopeId telescope that produced the frame
 */
public record Image(long id,
                    String filename,
                    String filterName,
                    String ccdsum,
                    String imageType,
                    Instant dateObs,
                    LocalDate dayObs,
                    String telescopeId) {

    public static final String BIAS = "BIAS";
    public static final String DARK = "DARK";
    public static final String SKYFLAT = "SKYFLAT";
    public static final String EXPOSE = "EXPOSE";

    public static final List<String> TYPES = List.of(BIAS, DARK, SKYFLAT, EXPOSE);
}
