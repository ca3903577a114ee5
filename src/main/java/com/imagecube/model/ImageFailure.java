package com.imagecube.model;

/** Fallo de una imagen en una etapa; el resto de imagenes sigue. */
public record ImageFailure(Stage stage, String fileName, String message) {

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", stage, fileName, message);
    }
}
