package com.imagecube.service;

import com.imagecube.model.ConversionFactorRow;
import com.imagecube.model.GridSpec;
import com.imagecube.model.ImageFailure;
import com.imagecube.model.ImageHeader;
import com.imagecube.model.ImageRecord;
import com.imagecube.model.PipelineConfig;
import com.imagecube.model.RasterImage;
import com.imagecube.model.RunReport;
import com.imagecube.model.SedSample;
import com.imagecube.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ejecuta las etapas habilitadas en orden fijo: conversion, registro, convolucion,
 * remuestreo y SED. Cada etapa escribe en su propio directorio y lee de la etapa anterior.
 */
public class PipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    /** Trabajo de una etapa sobre una imagen. */
    @FunctionalInterface
    interface ImageTask {
        RasterImage process(ImageRecord rec, RasterImage input);
    }

    private final ImageStore store;
    private final ConfigValidator validator;
    private final MetadataResolver resolver;
    private final FluxConversionService conversion;
    private final GridBuilder grids;
    private final WcsRegistrationService registration;
    private final ResolutionConvolver convolver;
    private final ResamplingService resampler;
    private final SedAssembler assembler;
    private volatile PipelineListener listener = PipelineListener.NONE;

    public PipelineOrchestrator(ImageStore store, RegistrationEngine registrationEngine, ConvolutionEngine convolutionEngine) {
        this.store = store;
        this.validator = new ConfigValidator();
        this.resolver = new MetadataResolver();
        this.conversion = new FluxConversionService();
        this.grids = new GridBuilder();
        this.registration = new WcsRegistrationService(registrationEngine);
        this.convolver = new ResolutionConvolver(convolutionEngine);
        this.resampler = new ResamplingService(grids, registration);
        this.assembler = new SedAssembler();
    }

    /** FITS en disco, reproyeccion TAN y convolucion de ImageJ. */
    public static PipelineOrchestrator createDefault() {
        return new PipelineOrchestrator(new FitsImageStore(), new TangentPlaneWarpEngine(), new ImageJConvolutionEngine());
    }

    public void setListener(PipelineListener listener) {
        this.listener = listener == null ? PipelineListener.NONE : listener;
    }

    /**
     * Ejecucion completa: validacion, limpieza o ingesta, informe de factores y etapas habilitadas.
     *
     * @throws ConfigurationException parametros o ficheros invalidos
     * @throws CalibrationException   calibracion imposible (fatal para toda la ejecucion)
     * @throws StageException         fallo de una imagen con la politica fail-fast
     */
    public RunReport run(PipelineConfig config) {
        validator.validate(config);
        RunReport report = new RunReport();
        if (config.cleanup()) {
            cleanup(config.directory());
            return report;
        }

        List<ImageRecord> records = ingest(config);
        report.setImageCount(records.size());

        if (config.conversionFactorsReport()) {
            listener.conversionFactors(conversionFactors(records));
        }
        if (config.stages().isEmpty()) {
            logger.info("Ninguna etapa habilitada");
            return report;
        }
        config.convolutionReferenceImagePath()
                .ifPresent(p -> logger.info("Imagen de referencia de convolucion: {}", p.getFileName()));

        // Agregados globales: se calculan una vez, antes de cualquier trabajo por imagen
        if (config.isEnabled(Stage.REGISTRATION) || config.isEnabled(Stage.RESAMPLING)) {
            report.setReferencePosition(grids.referencePosition(config, records, referenceHeader(config)));
        }
        if (config.isEnabled(Stage.CONVOLUTION) || config.isEnabled(Stage.RESAMPLING)) {
            report.setCommonFwhm(convolver.requireCommonFwhm(config, records));
        }
        if (config.isEnabled(Stage.RESAMPLING)) {
            report.setResamplingGrid(resampler.sharedGrid(config, report.commonFwhm(), report.referencePosition()));
        }

        ExecutorService exec = Executors.newFixedThreadPool(config.workers());
        try {
            for (Stage stage : Stage.values()) {
                if (!config.isEnabled(stage)) continue;
                runStage(stage, records, config, report, exec);
            }
        } finally {
            exec.shutdownNow();
        }

        if (report.hasFailures()) {
            logger.warn("Terminado con {} fallos", report.failures().size());
        } else {
            logger.info("Terminado: {}", report.completedStages());
        }
        return report;
    }

    /**
     * Lee, identifica y ordena por longitud de onda (orden estable) todas las imagenes de entrada.
     *
     * @throws ConfigurationException si no hay imagenes o alguna no se puede leer
     */
    public List<ImageRecord> ingest(PipelineConfig config) {
        List<Path> files;
        try {
            files = store.listInputs(config.directory());
        } catch (IOException e) {
            throw new ConfigurationException("No se pudo listar " + config.directory() + ": " + e.getMessage(), e);
        }
        if (files.isEmpty()) {
            throw new ConfigurationException("No hay imagenes FITS en " + config.directory());
        }
        List<ImageRecord> records = new ArrayList<>();
        for (Path f : files) {
            RasterImage img;
            try {
                img = store.read(f);
            } catch (IOException e) {
                throw new ConfigurationException("No se pudo leer " + f.getFileName() + ": " + e.getMessage(), e);
            }
            records.add(resolver.resolve(f, img));
        }
        records.sort(Comparator.comparingDouble(ImageRecord::wavelengthMicrons));
        logger.info("{} imagenes: {}", records.size(), records);
        return records;
    }

    public List<ConversionFactorRow> conversionFactors(List<ImageRecord> records) {
        return conversion.report(records);
    }

    /** Borra los directorios de todas las etapas y el del cubo. Los que no existen se ignoran. */
    public void cleanup(Path directory) {
        List<Path> dirs = new ArrayList<>();
        for (Stage s : Stage.values()) dirs.add(s.outputDirectory(directory));
        dirs.add(directory.resolve(Stage.DATACUBE_DIRECTORY));
        for (Path d : dirs) {
            if (!Files.exists(d)) continue;
            try (Stream<Path> walk = Files.walk(d)) {
                for (Path p : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                    Files.deleteIfExists(p);
                }
                logger.info("Borrado {}", d);
            } catch (IOException e) {
                throw new ConfigurationException("No se pudo borrar " + d + ": " + e.getMessage(), e);
            }
        }
    }

    private ImageHeader referenceHeader(PipelineConfig config) {
        Optional<Path> ref = config.referenceImagePath();
        if (ref.isEmpty()) return null;
        try {
            return store.read(ref.get()).header();
        } catch (IOException e) {
            throw new ConfigurationException("No se pudo leer la imagen de referencia " + ref.get() + ": " + e.getMessage(), e);
        }
    }

    private void runStage(Stage stage, List<ImageRecord> records, PipelineConfig config,
                          RunReport report, ExecutorService exec) {
        logger.info("== Etapa {} ({} imagenes) ==", stage, records.size());
        listener.stageStarted(stage, records.size());

        ImageTask task = taskFor(stage, config, report);
        List<Future<RasterImage>> futures = new ArrayList<>();
        for (ImageRecord rec : records) {
            futures.add(exec.submit(() -> processImage(stage, rec, config, task)));
        }

        List<RasterImage> done = new ArrayList<>();
        List<ImageRecord> doneRecords = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                done.add(futures.get(i).get());
                doneRecords.add(records.get(i));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof StageException) {
                    handleFailure((StageException) cause, config, report);
                } else if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                } else {
                    throw new PipelineException("Error inesperado en la etapa " + stage, cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PipelineException("Etapa " + stage + " interrumpida", e);
            }
        }

        if (stage == Stage.RESAMPLING && !done.isEmpty()) {
            writeDatacube(done, config, report);
        } else if (stage == Stage.SED) {
            writeSeds(done, doneRecords, config, report);
        }

        report.markCompleted(stage);
        listener.stageFinished(stage);
        logger.info("== Etapa {} terminada ==", stage);
    }

    private ImageTask taskFor(Stage stage, PipelineConfig config, RunReport report) {
        switch (stage) {
            case CONVERSION:
                return conversion::apply;
            case REGISTRATION:
                return (rec, in) -> {
                    GridSpec grid = grids.forRegistration(config, rec, report.referencePosition());
                    return registration.warp(Stage.REGISTRATION, rec.fileName(), in, grid, false);
                };
            case CONVOLUTION:
                return (rec, in) -> convolver.convolve(rec, in, report.commonFwhm());
            case RESAMPLING:
                return (rec, in) -> resampler.resample(rec, in, report.resamplingGrid());
            default:
                return (rec, in) -> in;
        }
    }

    private RasterImage processImage(Stage stage, ImageRecord rec, PipelineConfig config, ImageTask task) {
        RasterImage input = loadInput(stage, rec, config);
        RasterImage out = task.process(rec, input);
        if (stage != Stage.SED) {
            Path file = stage.outputFile(config.directory(), rec.stem());
            try {
                store.write(out, file);
            } catch (IOException e) {
                throw new StageException(stage, rec.fileName(), "No se pudo escribir " + file + ": " + e.getMessage(), e);
            }
        }
        rec.setImage(out, stage);
        listener.imageProcessed(stage, rec);
        return out;
    }

    /**
     * Imagen en memoria si la produjo la etapa de la que se lee. Si esa etapa esta habilitada en esta
     * ejecucion y la imagen no llego a ella, se omite; el fichero en disco seria de una ejecucion anterior.
     * Si no esta habilitada, se lee su fichero.
     */
    private RasterImage loadInput(Stage stage, ImageRecord rec, PipelineConfig config) {
        Optional<Stage> from = stage.inputStage(config.stages());
        if (from.isEmpty() || rec.currentStage() == from.get()) return rec.image();
        if (config.isEnabled(from.get())) {
            throw new StageException(stage, rec.fileName(), "omitida: fallo en " + from.get());
        }

        Path file = from.get().outputFile(config.directory(), rec.stem());
        try {
            return store.read(file);
        } catch (IOException e) {
            throw new StageException(stage, rec.fileName(), "No se pudo leer " + file + ": " + e.getMessage(), e);
        }
    }

    private void handleFailure(StageException e, PipelineConfig config, RunReport report) {
        logger.warn("{}", e.getMessage());
        report.addFailure(new ImageFailure(e.getStage(), e.getFileName(), e.getReason()));
        listener.imageFailed(e);
        if (config.failFast()) throw e;
    }

    private void writeDatacube(List<RasterImage> planes, PipelineConfig config, RunReport report) {
        Path file = Stage.datacubeFile(config.directory());
        try {
            double[][][] cube = assembler.buildCube(planes, Stage.RESAMPLING);
            store.writeCube(cube, assembler.cubeHeader(planes), file);
        } catch (StageException e) {
            handleFailure(e, config, report);
        } catch (IOException e) {
            handleFailure(new StageException(Stage.RESAMPLING, Stage.DATACUBE_FILE, e.getMessage(), e), config, report);
        }
    }

    private void writeSeds(List<RasterImage> planes, List<ImageRecord> planeRecords, PipelineConfig config, RunReport report) {
        Path file = Stage.SED.outputDirectory(config.directory()).resolve(Stage.SED_TABLE_FILE);
        try {
            double[][][] cube = assembler.buildCube(planes, Stage.SED);
            double[] wavelengths = new double[planeRecords.size()];
            for (int i = 0; i < wavelengths.length; i++) wavelengths[i] = planeRecords.get(i).wavelengthMicrons();
            List<SedSample> samples = assembler.extract(cube, wavelengths);
            assembler.writeTable(samples, file);
        } catch (StageException e) {
            handleFailure(e, config, report);
        } catch (IOException e) {
            handleFailure(new StageException(Stage.SED, Stage.SED_TABLE_FILE, e.getMessage(), e), config, report);
        }
    }
}
