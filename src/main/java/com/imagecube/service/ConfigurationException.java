package com.imagecube.service;

/** Parametros invalidos, directorio o fichero inexistente o ilegible. Fatal. */
public class ConfigurationException extends PipelineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
