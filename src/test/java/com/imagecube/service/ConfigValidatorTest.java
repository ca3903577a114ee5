package com.imagecube.service;

import com.imagecube.model.PipelineConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidatorTest {

    @TempDir
    Path dir;

    private final ConfigValidator validator = new ConfigValidator();

    private PipelineConfig.Builder valid() {
        return PipelineConfig.builder().directory(dir).angularSize(300).allStages();
    }

    @Test
    void acceptsMinimalConfiguration() {
        assertDoesNotThrow(() -> validator.validate(valid().build()));
    }

    @Test
    void directoryMustExist() {
        assertThrows(ConfigurationException.class,
                () -> validator.validate(valid().directory(dir.resolve("nope")).build()));
        assertThrows(ConfigurationException.class,
                () -> validator.validate(valid().directory(null).build()));
    }

    @Test
    void angularSizeMustBePositive() {
        assertThrows(ConfigurationException.class, () -> validator.validate(valid().angularSize(0).build()));
        assertThrows(ConfigurationException.class, () -> validator.validate(valid().angularSize(Double.NaN).build()));
        assertThrows(ConfigurationException.class,
                () -> validator.validate(valid().angularSize(Double.POSITIVE_INFINITY).build()));
    }

    @Test
    void cleanupOnlyNeedsTheDirectory() {
        PipelineConfig cleanup = PipelineConfig.builder().directory(dir).angularSize(Double.NaN).cleanup(true).build();
        assertDoesNotThrow(() -> validator.validate(cleanup));
    }

    @Test
    void coordinatesOutOfRange() {
        assertThrows(ConfigurationException.class, () -> validator.validate(valid().ra(360.0).build()));
        assertThrows(ConfigurationException.class, () -> validator.validate(valid().ra(-0.1).build()));
        assertThrows(ConfigurationException.class, () -> validator.validate(valid().dec(90.5).build()));
        assertDoesNotThrow(() -> validator.validate(valid().ra(0.0).dec(-90.0).build()));
    }

    @Test
    void fwhmAndWorkers() {
        assertThrows(ConfigurationException.class, () -> validator.validate(valid().fwhm(0.0).build()));
        assertThrows(ConfigurationException.class, () -> validator.validate(valid().workers(0).build()));
        assertDoesNotThrow(() -> validator.validate(valid().fwhm(18.0).workers(4).build()));
    }

    @Test
    void referenceImagesAreResolvedAgainstTheDirectory() throws Exception {
        assertThrows(ConfigurationException.class,
                () -> validator.validate(valid().referenceImage("ref.fits").build()));
        assertThrows(ConfigurationException.class,
                () -> validator.validate(valid().convolutionReferenceImage("conv.fits").build()));

        Files.createFile(dir.resolve("ref.fits"));
        Files.createFile(dir.resolve("conv.fits"));
        assertDoesNotThrow(() -> validator.validate(valid()
                .referenceImage("ref.fits").convolutionReferenceImage("conv.fits").build()));
    }
}
