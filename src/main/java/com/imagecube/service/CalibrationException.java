package com.imagecube.service;

/**
 * La calibracion fisica no puede continuar: instrumento desconocido, factor de conversion 0,
 * FWHM comun 0 o posicion de referencia indefinida. Fatal, sin reintentos.
 */
public class CalibrationException extends PipelineException {

    public CalibrationException(String message) {
        super(message);
    }
}
