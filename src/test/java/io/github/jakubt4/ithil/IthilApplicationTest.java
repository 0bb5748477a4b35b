package io.github.jakubt4.ithil;

import io.github.jakubt4.ithil.config.ReductionProperties;
import io.github.jakubt4.ithil.config.ReductionRequestFactory;
import io.github.jakubt4.ithil.config.ReductionRunner;
import io.github.jakubt4.ithil.error.StageExecutionException;
import io.github.jakubt4.ithil.model.Image;
import io.github.jakubt4.ithil.orchestration.ReductionOrchestrator;
import io.github.jakubt4.ithil.stage.StageRegistry;
import io.github.jakubt4.ithil.store.ImageEntity;
import io.github.jakubt4.ithil.store.ImageRepository;
import io.github.jakubt4.ithil.store.TelescopeEntity;
import io.github.jakubt4.ithil.store.TelescopeRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class IthilApplicationTest {

    private static final LocalDate NIGHT = LocalDate.of(2015, 10, 1);

    @Autowired
    private ApplicationContext context;

    @Autowired
    private ReductionRequestFactory requestFactory;

    @Autowired
    private ReductionOrchestrator orchestrator;

    @Autowired
    private StageRegistry stageRegistry;

    @Autowired
    private TelescopeRepository telescopeRepository;

    @Autowired
    private ImageRepository imageRepository;

    @TempDir
    Path workspace;

    @BeforeEach
    void seed() throws IOException {
        final var kb78 = telescope("1m0-009", "lsc", "kb78", "SBig");
        final var kb74 = telescope("1m0-010", "elp", "kb74", "SBig");
        rawFrame(kb78, "lsc1m009-kb78-20151001-0001-b00.fits", "2 2", Image.BIAS, "2015-10-01T22:01:00Z");
        rawFrame(kb78, "lsc1m009-kb78-20151001-0002-b00.fits", "2 2", Image.BIAS, "2015-10-01T22:02:00Z");
        rawFrame(kb78, "lsc1m009-kb78-20151001-0003-b00.fits", "1 1", Image.BIAS, "2015-10-01T22:03:00Z");
        rawFrame(kb74, "elp1m010-kb74-20151001-0001-b00.fits", "2 2", Image.BIAS, "2015-10-02T03:01:00Z");
    }

    @AfterEach
    void cleanUp() {
        imageRepository.deleteAll();
        telescopeRepository.deleteAll();
    }

    @Test
    void runnerStaysInactiveWithoutAnEpoch() {
        assertThat(context.getBeanNamesForType(ReductionRunner.class)).isEmpty();
        assertThat(stageRegistry.names()).containsExactly("ingest", "make_bias", "subtract_bias", "trim",
                "make_dark", "subtract_dark", "make_flat", "divide_flat", "solve_wcs", "make_catalog");
    }

    @Test
    void reducesTheSelectedTelescopesAndBinning() {
        final var request = requestFactory.create(properties("ingest-make_bias", "lsc", "2x2"));

        final var report = orchestrator.run(request);

        assertThat(report.completedStages()).containsExactly("ingest", "make_bias");
        assertThat(report.telescopeIds()).containsExactly("1m0-009");
        final var night = workspace.resolve("processed/lsc/kb78/20151001");
        assertThat(night.resolve("lsc1m009-kb78-20151001-0001-b00.fits")).exists();
        assertThat(night.resolve("lsc1m009-kb78-20151001-0003-b00.fits")).doesNotExist();
        assertThat(night.resolve("bias_kb78_20151001_bin2x2.fits"))
                .hasContent("lsc1m009-kb78-20151001-0001-b00.fits");
        assertThat(workspace.resolve("processed/elp")).doesNotExist();
    }

    @Test
    void stageWithMissingInputsFailsTheRun() {
        final var request = requestFactory.create(properties("make_bias", "", ""));

        assertThatThrownBy(() -> orchestrator.run(request))
                .isInstanceOfSatisfying(StageExecutionException.class,
                        e -> assertThat(e.getStageName()).isEqualTo("make_bias"));
    }

    private ReductionProperties properties(final String stage, final String site, final String binning) {
        return new ReductionProperties("20151001", site, "", "", "", stage,
                workspace.resolve("raw"), workspace.resolve("processed"), "", binning, "", 2, "info", false);
    }

    private TelescopeEntity telescope(final String telescopeId,
                                      final String site,
                                      final String instrument,
                                      final String cameraType) {
        final var entity = new TelescopeEntity();
        entity.setTelescopeId(telescopeId);
        entity.setSite(site);
        entity.setInstrument(instrument);
        entity.setCameraType(cameraType);
        return telescopeRepository.save(entity);
    }

    private void rawFrame(final TelescopeEntity telescope,
                          final String filename,
                          final String ccdsum,
                          final String imageType,
                          final String dateObs) throws IOException {
        final var entity = new ImageEntity();
        entity.setTelescope(telescope);
        entity.setFilename(filename);
        entity.setCcdsum(ccdsum);
        entity.setImageType(imageType);
        entity.setDateObs(Instant.parse(dateObs));
        entity.setDayObs(NIGHT);
        imageRepository.save(entity);

        final var path = workspace.resolve("raw")
                .resolve(telescope.getSite())
                .resolve(telescope.getInstrument())
                .resolve("20151001")
                .resolve(filename);
        Files.createDirectories(path.getParent());
        Files.writeString(path, filename);
    }
}
