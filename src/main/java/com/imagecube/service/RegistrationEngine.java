package com.imagecube.service;

import com.imagecube.model.GridSpec;
import com.imagecube.model.RasterImage;

/** Motor de reproyeccion: lleva una imagen con WCS a la rejilla indicada. */
public interface RegistrationEngine {

    /**
     * @param fluxConserving si true, escala por el cociente de areas de pixel (conserva el flujo total)
     * @return array [y][x] del tamano de la rejilla; NaN fuera de la imagen de origen
     * @throws IllegalArgumentException si la imagen no tiene un WCS utilizable
     */
    double[][] warp(RasterImage source, GridSpec grid, boolean fluxConserving);
}
