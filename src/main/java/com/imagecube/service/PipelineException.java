package com.imagecube.service;

/**
 * Base de los errores del pipeline.
 * <p>
 * {@link ConfigurationException} y {@link CalibrationException} abortan la ejecucion;
 * {@link StageException} afecta solo a una imagen en una etapa.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
