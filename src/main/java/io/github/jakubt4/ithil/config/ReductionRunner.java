package io.github.jakubt4.ithil.config;

import io.github.jakubt4.ithil.orchestration.ReductionOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Runs the configured reduction once at startup. Only active when
 * {@code reduction.epoch} is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "reduction", name = "epoch")
public class ReductionRunner implements ApplicationRunner {

    static final String APPLICATION_LOGGER = "io.github.jakubt4.ithil";

    private final ReductionProperties properties;
    private final ReductionRequestFactory requestFactory;
    private final ReductionOrchestrator orchestrator;
    private final LoggingSystem loggingSystem;

    @Override
    public void run(final ApplicationArguments args) {
        loggingSystem.setLogLevel(APPLICATION_LOGGER, toLogLevel(properties.logLevel()));
        log.info("Starting reduction — epoch={}, stage={}, workers={}",
                properties.epoch(), properties.stage().isBlank() ? "<all>" : properties.stage(),
                properties.workers());

        final var request = requestFactory.create(properties);
        final var report = orchestrator.run(request);

        log.info("Reduction finished — {} stage(s) {} over {} night(s) and {} telescope(s)",
                report.stages().size(), report.completedStages(), report.epochs().size(),
                report.telescopeIds().size());
    }

    static LogLevel toLogLevel(final String level) {
        return switch (level.toLowerCase(Locale.ROOT)) {
            case "debug" -> LogLevel.DEBUG;
            case "warning" -> LogLevel.WARN;
            case "error" -> LogLevel.ERROR;
            case "critical", "fatal" -> LogLevel.FATAL;
            default -> LogLevel.INFO;
        };
    }
}
