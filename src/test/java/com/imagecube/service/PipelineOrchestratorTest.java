package com.imagecube.service;

import com.imagecube.model.ConversionFactorRow;
import com.imagecube.model.ImageFailure;
import com.imagecube.model.ImageHeader;
import com.imagecube.model.ImageRecord;
import com.imagecube.model.PipelineConfig;
import com.imagecube.model.RasterImage;
import com.imagecube.model.RunReport;
import com.imagecube.model.Stage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

import static com.imagecube.service.Fixtures.header;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineOrchestratorTest {

    @TempDir
    Path dir;

    private ImageStore store;
    private final RegistrationEngine gridFiller = (src, grid, fluxConserving) ->
            Fixtures.constant(grid.pixelCountX(), grid.pixelCountY(), 1.0);
    private final ConvolutionEngine passThrough = (pixels, kernel) -> pixels;

    @BeforeEach
    void setUp() throws Exception {
        store = mock(ImageStore.class);
        when(store.read(any())).thenAnswer(inv -> imageFor(inv.getArgument(0)));
    }

    private static RasterImage imageFor(Path p) {
        String name = p.getFileName().toString();
        if (name.contains("irac")) return Fixtures.irac(60, 1.0);
        if (name.contains("mips")) return Fixtures.mips(40, 1.0);
        if (name.contains("spire")) return Fixtures.spire(20, 1.0);
        if (name.contains("wise")) {
            ImageHeader h = header("INSTRUME", "WISE", "CDELT2", 1.0 / 3600);
            h.set("WAVELENG", 3.4, "micron");
            return new RasterImage(Fixtures.constant(4, 4, 1), h);
        }
        return new RasterImage(Fixtures.constant(4, 4, 1), header("OBJECT", "M31", "WAVELNTH", 1.0));
    }

    private void inputs(String... names) throws Exception {
        List<Path> files = new ArrayList<>();
        for (String n : names) files.add(dir.resolve(n));
        when(store.listInputs(dir)).thenReturn(files);
    }

    private PipelineOrchestrator orchestrator(RegistrationEngine registration) {
        return new PipelineOrchestrator(store, registration, passThrough);
    }

    private PipelineConfig.Builder config(Stage... stages) {
        PipelineConfig.Builder b = PipelineConfig.builder().directory(dir).angularSize(60);
        for (Stage s : stages) b.stage(s, true);
        return b;
    }

    @Test
    @DisplayName("Las imagenes quedan ordenadas por longitud de onda sea cual sea el orden del listado")
    void ingestSortsByWavelength() throws Exception {
        inputs("spire.fits", "irac.fits", "mips.fits");
        List<ImageRecord> records = orchestrator(gridFiller).ingest(config().build());
        assertEquals(List.of("irac.fits", "mips.fits", "spire.fits"),
                records.stream().map(ImageRecord::fileName).collect(Collectors.toList()));
    }

    @Test
    void equalWavelengthsKeepListingOrder() throws Exception {
        inputs("spire.fits", "irac_b.fits", "irac_a.fits");
        List<ImageRecord> records = orchestrator(gridFiller).ingest(config().build());
        assertEquals(List.of("irac_b.fits", "irac_a.fits", "spire.fits"),
                records.stream().map(ImageRecord::fileName).collect(Collectors.toList()));
    }

    @Test
    void conversionWritesOneArtifactPerImage() throws Exception {
        inputs("irac.fits", "spire.fits");
        RunReport report = orchestrator(gridFiller).run(config(Stage.CONVERSION).build());

        verify(store).write(any(), eq(Stage.CONVERSION.outputFile(dir, "irac")));
        verify(store).write(any(), eq(Stage.CONVERSION.outputFile(dir, "spire")));
        assertEquals(EnumSet.of(Stage.CONVERSION), report.completedStages());
        assertFalse(report.hasFailures());
        assertEquals(2, report.imageCount());
    }

    @Test
    void zeroConversionFactorAbortsTheRun() throws Exception {
        inputs("irac.fits", "wise.fits");
        assertThrows(CalibrationException.class, () -> orchestrator(gridFiller).run(config(Stage.CONVERSION).build()));
    }

    @Test
    void unresolvableInstrumentAbortsTheRun() throws Exception {
        inputs("irac.fits", "mystery.fits");
        assertThrows(CalibrationException.class, () -> orchestrator(gridFiller).run(config(Stage.CONVERSION).build()));
        verify(store, never()).write(any(), any());
    }

    @Test
    @DisplayName("Una imagen que falla se informa y las demas terminan la etapa")
    void continueAndReport() throws Exception {
        inputs("irac.fits", "mips.fits", "spire.fits");
        RegistrationEngine failsOnMips = (src, grid, fc) -> {
            if ("MIPS".equals(src.header().getString("INSTRUME"))) throw new IllegalArgumentException("WCS singular");
            return Fixtures.constant(grid.pixelCountX(), grid.pixelCountY(), 1.0);
        };

        RunReport report = orchestrator(failsOnMips).run(config(Stage.CONVERSION, Stage.REGISTRATION).workers(3).build());

        assertEquals(1, report.failures().size());
        ImageFailure f = report.failures().get(0);
        assertEquals(Stage.REGISTRATION, f.stage());
        assertEquals("mips.fits", f.fileName());
        verify(store).write(any(), eq(Stage.REGISTRATION.outputFile(dir, "irac")));
        verify(store).write(any(), eq(Stage.REGISTRATION.outputFile(dir, "spire")));
        verify(store, never()).write(any(), eq(Stage.REGISTRATION.outputFile(dir, "mips")));
        assertTrue(report.isCompleted(Stage.REGISTRATION));
    }

    @Test
    @DisplayName("Una imagen que falla en una etapa no sigue con ficheros antiguos de esa etapa")
    void failedImageIsNotResumedFromStaleArtifacts() throws Exception {
        inputs("irac.fits", "mips.fits", "spire.fits");
        RegistrationEngine failsOnMips = (src, grid, fc) -> {
            if ("MIPS".equals(src.header().getString("INSTRUME"))) throw new IllegalArgumentException("WCS singular");
            return Fixtures.constant(grid.pixelCountX(), grid.pixelCountY(), 1.0);
        };

        RunReport report = orchestrator(failsOnMips)
                .run(config(Stage.CONVERSION, Stage.REGISTRATION, Stage.CONVOLUTION).build());

        verify(store, never()).read(Stage.REGISTRATION.outputFile(dir, "mips"));
        verify(store, never()).write(any(), eq(Stage.CONVOLUTION.outputFile(dir, "mips")));
        verify(store).write(any(), eq(Stage.CONVOLUTION.outputFile(dir, "irac")));
        assertEquals(2, report.failures().size());
        ImageFailure skipped = report.failures().get(1);
        assertEquals(Stage.CONVOLUTION, skipped.stage());
        assertEquals("mips.fits", skipped.fileName());
        assertTrue(skipped.message().contains("REGISTRATION"));
    }

    @Test
    void failFastRethrowsFirstFailure() throws Exception {
        inputs("irac.fits", "mips.fits", "spire.fits");
        RegistrationEngine failsOnMips = (src, grid, fc) -> {
            if ("MIPS".equals(src.header().getString("INSTRUME"))) throw new IllegalArgumentException("WCS singular");
            return Fixtures.constant(grid.pixelCountX(), grid.pixelCountY(), 1.0);
        };
        PipelineConfig config = config(Stage.CONVERSION, Stage.REGISTRATION).failFast(true).build();
        StageException e = assertThrows(StageException.class, () -> orchestrator(failsOnMips).run(config));
        assertEquals("mips.fits", e.getFileName());
    }

    @Test
    @DisplayName("Una etapa ejecutada sola lee de disco los ficheros de la etapa anterior")
    void stageAloneReadsPredecessorOutput() throws Exception {
        inputs("irac.fits", "spire.fits");
        orchestrator(gridFiller).run(config(Stage.CONVOLUTION).build());

        verify(store).read(Stage.REGISTRATION.outputFile(dir, "irac"));
        verify(store).read(Stage.REGISTRATION.outputFile(dir, "spire"));
        verify(store).write(any(), eq(Stage.CONVOLUTION.outputFile(dir, "irac")));
    }

    @Test
    void chainedStagesUseImagesInMemory() throws Exception {
        inputs("irac.fits", "spire.fits");
        orchestrator(gridFiller).run(config(Stage.CONVERSION, Stage.REGISTRATION).build());

        verify(store, never()).read(Stage.CONVERSION.outputFile(dir, "irac"));
        verify(store, times(1)).read(dir.resolve("irac.fits"));
    }

    @Test
    void referencePositionNeedsHerschelImages() throws Exception {
        inputs("irac.fits", "mips.fits");
        assertThrows(CalibrationException.class,
                () -> orchestrator(gridFiller).run(config(Stage.CONVERSION, Stage.REGISTRATION).build()));
        verify(store, never()).write(any(), any());

        RunReport report = orchestrator(gridFiller).run(config(Stage.CONVERSION, Stage.REGISTRATION).ra(150.0).dec(2.0).build());
        assertFalse(report.hasFailures());
    }

    @Test
    void aggregatesComputedBeforeStages() throws Exception {
        inputs("irac.fits", "mips.fits", "spire.fits");
        RunReport report = orchestrator(gridFiller).run(config(Stage.CONVOLUTION, Stage.RESAMPLING).build());

        assertEquals(22.0, report.commonFwhm());
        assertEquals(150.0, report.referencePosition().ra());
        assertEquals(2.0, report.referencePosition().dec());
        assertEquals(22.0 / ResamplingService.NYQUIST_SAMPLING_RATE, report.resamplingGrid().pixelScaleX(), 1e-12);
        verify(store).writeCube(any(), any(), eq(Stage.datacubeFile(dir)));
    }

    @Test
    void fullRunWritesSedTable() throws Exception {
        inputs("spire.fits", "mips.fits", "irac.fits");
        RunReport report = orchestrator(gridFiller).run(config().allStages().build());

        assertEquals(EnumSet.allOf(Stage.class), report.completedStages());
        int n = report.resamplingGrid().pixelCountX();
        List<String> lines = Files.readAllLines(dir.resolve("seds").resolve("sed_table.txt"), StandardCharsets.UTF_8);
        assertEquals(SedAssembler.TABLE_HEADER, lines.get(0));
        assertEquals(1 + 3 * n * n, lines.size());
        assertEquals("0,0,8.000000,1.000000", lines.get(1));
        assertEquals("0,0,24.000000,1.000000", lines.get(2));
        assertEquals("0,0,250.000000,1.000000", lines.get(3));
    }

    @Test
    void cleanupIsIdempotentAndSkipsProcessing() throws Exception {
        Files.createDirectories(dir.resolve("converted"));
        Files.createFile(dir.resolve("converted").resolve("irac_converted.fits"));
        Files.createDirectories(dir.resolve("datacube"));
        Files.createDirectories(dir.resolve("seds"));
        PipelineOrchestrator o = orchestrator(gridFiller);
        PipelineConfig cleanup = PipelineConfig.builder().directory(dir).cleanup(true).build();

        o.run(cleanup);
        o.run(cleanup);

        for (Stage s : Stage.values()) assertFalse(Files.exists(s.outputDirectory(dir)), s.name());
        assertFalse(Files.exists(dir.resolve("datacube")));
        verify(store, never()).listInputs(any());
    }

    @Test
    void conversionFactorReportGoesToListener() throws Exception {
        inputs("irac.fits", "wise.fits");
        List<ConversionFactorRow> seen = new ArrayList<>();
        PipelineOrchestrator o = orchestrator(gridFiller);
        o.setListener(new PipelineListener() {
            @Override
            public void conversionFactors(List<ConversionFactorRow> rows) {
                seen.addAll(rows);
            }
        });

        RunReport report = o.run(config().conversionFactorsReport(true).build());

        assertEquals(2, seen.size());
        assertEquals("wise.fits", seen.get(0).fileName());
        assertEquals(0.0, seen.get(0).factor());
        assertTrue(report.completedStages().isEmpty());
        verify(store, never()).write(any(), any());
    }

    @Test
    void invalidConfigurationIsRejectedBeforeReading() throws Exception {
        PipelineOrchestrator o = orchestrator(gridFiller);
        assertThrows(ConfigurationException.class,
                () -> o.run(PipelineConfig.builder().directory(dir.resolve("missing")).angularSize(60).build()));
        assertThrows(ConfigurationException.class,
                () -> o.run(PipelineConfig.builder().directory(dir).angularSize(-1).build()));
        verify(store, never()).listInputs(any());
    }

    @Test
    void emptyDirectoryIsAConfigurationError() throws Exception {
        inputs();
        assertThrows(ConfigurationException.class, () -> orchestrator(gridFiller).run(config(Stage.CONVERSION).build()));
    }
}
