package com.imagecube.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StageTest {

    @Test
    void outputFileFollowsStemAndStageName() {
        Path base = Paths.get("data");
        assertEquals(Paths.get("data", "registered", "m31_irac_registered.fits"),
                Stage.REGISTRATION.outputFile(base, "m31_irac"));
        assertEquals(Paths.get("data", "datacube", "datacube.fits"), Stage.datacubeFile(base));
    }

    @Test
    void conversionReadsOriginalImages() {
        assertEquals(Optional.empty(), Stage.CONVERSION.inputStage(EnumSet.allOf(Stage.class)));
    }

    @Test
    void laterStagesReadLatestEnabledPredecessor() {
        EnumSet<Stage> enabled = EnumSet.of(Stage.CONVERSION, Stage.CONVOLUTION, Stage.RESAMPLING);
        assertEquals(Optional.of(Stage.CONVERSION), Stage.CONVOLUTION.inputStage(enabled));
        assertEquals(Optional.of(Stage.CONVOLUTION), Stage.RESAMPLING.inputStage(enabled));
    }

    @Test
    void withoutEnabledPredecessorReadImmediatePredecessor() {
        EnumSet<Stage> enabled = EnumSet.of(Stage.CONVOLUTION);
        assertEquals(Optional.of(Stage.REGISTRATION), Stage.CONVOLUTION.inputStage(enabled));
    }

    @Test
    void sedAlwaysReadsResampled() {
        assertEquals(Optional.of(Stage.RESAMPLING), Stage.SED.inputStage(EnumSet.of(Stage.CONVERSION, Stage.SED)));
    }
}
