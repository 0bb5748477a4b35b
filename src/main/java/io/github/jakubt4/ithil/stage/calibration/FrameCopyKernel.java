package io.github.jakubt4.ithil.stage.calibration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

/**
 * Kernel that moves frames through the processed tree without touching pixel
 * data. A master is written as a copy of the first frame of its group.
 */
@Slf4j
@Component
public class FrameCopyKernel implements CalibrationKernel {

    @Override
    public void combine(final String stage, final List<Path> frames, final Path master) throws IOException {
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("No frames to combine into " + master);
        }
        copy(frames.get(0), master);
        log.debug("[{}] Wrote master {} from {} frame(s)", stage, master.getFileName(), frames.size());
    }

    @Override
    public void apply(final String stage, final Path frame, final Optional<Path> master, final Path output)
            throws IOException {
        copy(frame, output);
        log.debug("[{}] Processed {}{}", stage, output.getFileName(),
                master.map(m -> " against " + m.getFileName()).orElse(""));
    }

    private static void copy(final Path source, final Path target) throws IOException {
        if (Files.exists(target) && Files.isSameFile(source, target)) {
            return;
        }
        Files.createDirectories(target.getParent());
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
}
