package com.imagecube.model;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/** Etapas del pipeline, en su orden fijo de ejecucion. */
public enum Stage {
    CONVERSION("converted"),
    REGISTRATION("registered"),
    CONVOLUTION("convolved"),
    RESAMPLING("resampled"),
    SED("seds");

    public static final String DATACUBE_DIRECTORY = "datacube";
    public static final String DATACUBE_FILE = "datacube.fits";
    public static final String SED_TABLE_FILE = "sed_table.txt";
    public static final String FITS_EXTENSION = ".fits";

    private final String directoryName;

    Stage(String directoryName) {
        this.directoryName = directoryName;
    }

    public String directoryName() {
        return directoryName;
    }

    public Path outputDirectory(Path baseDirectory) {
        return baseDirectory.resolve(directoryName);
    }

    /** {@code <base>/<dir>/<stem>_<dir>.fits} */
    public Path outputFile(Path baseDirectory, String stem) {
        return outputDirectory(baseDirectory).resolve(stem + "_" + directoryName + FITS_EXTENSION);
    }

    /**
     * De que etapa lee sus datos esta etapa: la ultima anterior habilitada en esta ejecucion,
     * o si no hay ninguna, la inmediatamente anterior (resultados de una ejecucion previa).
     * Vacio = imagenes originales.
     */
    public Optional<Stage> inputStage(Set<Stage> enabled) {
        if (this == CONVERSION) return Optional.empty();
        // SEDs y cubo siempre trabajan sobre las imagenes remuestreadas
        if (this == SED) return Optional.of(RESAMPLING);
        Stage[] all = values();
        for (int i = ordinal() - 1; i >= 0; i--) {
            if (enabled.contains(all[i])) return Optional.of(all[i]);
        }
        return Optional.of(all[ordinal() - 1]);
    }

    public static Path datacubeFile(Path baseDirectory) {
        return baseDirectory.resolve(DATACUBE_DIRECTORY).resolve(DATACUBE_FILE);
    }
}
