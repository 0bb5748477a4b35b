package io.github.jakubt4.ithil.stage.calibration;

import io.github.jakubt4.ithil.epoch.EpochExpander;
import io.github.jakubt4.ithil.model.Image;
import io.github.jakubt4.ithil.model.Telescope;
import io.github.jakubt4.ithil.selection.Binning;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * On-disk layout shared by the raw archive and the processed tree:
 * {@code <root>/<site>/<instrument>/<yyyyMMdd>/<file>}.
 */
final class FrameLayout {

    private static final String MASTER_EXTENSION = ".fits";

    private FrameLayout() {
    }

    static Path nightDirectory(final Path root, final Telescope telescope, final LocalDate dayObs) {
        return root.resolve(telescope.site())
                .resolve(telescope.instrument())
                .resolve(EpochExpander.dayObs(dayObs));
    }

    static Path frame(final Path root, final Telescope telescope, final Image image) {
        return nightDirectory(root, telescope, image.dayObs()).resolve(image.filename());
    }

    /**
     * e.g. {@code bias_kb78_20151001_bin2x2.fits}, or {@code flat_kb78_20151001_bin2x2_rp.fits}
     * when the product is split by filter.
     *
     * @param filterName filter of the product, {@code null} if not split by filter
     */
    static Path master(final Path processedRoot,
                       final Telescope telescope,
                       final LocalDate dayObs,
                       final String product,
                       final String ccdsum,
                       final String filterName) {
        if (ccdsum == null) {
            throw new IllegalArgumentException("Cannot name a " + product + " master without a binning");
        }
        final var name = new StringBuilder()
                .append(product)
                .append('_').append(telescope.instrument())
                .append('_').append(EpochExpander.dayObs(dayObs))
                .append("_bin").append(Binning.toCompact(ccdsum));
        if (filterName != null) {
            name.append('_').append(filterName);
        }
        return nightDirectory(processedRoot, telescope, dayObs).resolve(name.append(MASTER_EXTENSION).toString());
    }
}
