package com.imagecube.service;

import com.imagecube.model.ImageHeader;
import com.imagecube.model.RasterImage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Lectura y escritura del contenedor de imagenes en disco. */
public interface ImageStore {

    /** Ficheros de imagen del directorio de entrada, ordenados por nombre. */
    List<Path> listInputs(Path directory) throws IOException;

    RasterImage read(Path file) throws IOException;

    /** Sobrescribe el fichero si existe y crea los directorios que falten. */
    void write(RasterImage image, Path file) throws IOException;

    void writeCube(double[][][] cube, ImageHeader header, Path file) throws IOException;
}
