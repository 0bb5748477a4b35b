package io.github.jakubt4.ithil;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Ithil, the calibration pipeline orchestrator for LCOGT imaging data.
 *
 * <p>Selects a night or night range and a subset of telescopes from the
 * metadata store, then runs the requested range of reduction stages (ingest,
 * bias, dark and flat calibration, trimming, astrometry, cataloguing) over the
 * matching frames, one stage at a time.
 *
 * @see io.github.jakubt4.ithil.orchestration.ReductionOrchestrator
 * @see io.github.jakubt4.ithil.config.PipelineConfig
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class IthilApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(IthilApplication.class, args)));
    }
}
