package com.imagecube.service;

import com.imagecube.model.PipelineConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Comprueba la configuracion antes de tocar ninguna imagen. */
public class ConfigValidator {

    /** @throws ConfigurationException con el primer problema encontrado */
    public void validate(PipelineConfig config) {
        Path dir = config.directory();
        if (dir == null) throw new ConfigurationException("Falta el directorio de entrada");
        if (!Files.isDirectory(dir)) throw new ConfigurationException("El directorio no existe: " + dir);
        if (config.cleanup()) return;

        if (!(config.angularSize() > 0) || Double.isInfinite(config.angularSize())) {
            throw new ConfigurationException("El tamano angular debe ser un numero positivo (arcsec): " + config.angularSize());
        }
        if (config.ra() != null && !(config.ra() >= 0 && config.ra() < 360)) {
            throw new ConfigurationException("RA fuera de rango [0, 360): " + config.ra());
        }
        if (config.dec() != null && !(config.dec() >= -90 && config.dec() <= 90)) {
            throw new ConfigurationException("DEC fuera de rango [-90, 90]: " + config.dec());
        }
        if (config.fwhm() != null && !(config.fwhm() > 0)) {
            throw new ConfigurationException("El FWHM debe ser positivo: " + config.fwhm());
        }
        if (config.workers() < 1) {
            throw new ConfigurationException("Hace falta al menos un hilo de trabajo: " + config.workers());
        }
        requireFile(config.referenceImagePath(), "imagen de referencia");
        requireFile(config.convolutionReferenceImagePath(), "imagen de referencia de convolucion");
    }

    private static void requireFile(Optional<Path> file, String what) {
        if (file.isPresent() && !Files.isRegularFile(file.get())) {
            throw new ConfigurationException("No existe la " + what + ": " + file.get());
        }
    }
}
