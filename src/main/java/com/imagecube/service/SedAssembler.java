package com.imagecube.service;

import com.imagecube.model.ImageHeader;
import com.imagecube.model.RasterImage;
import com.imagecube.model.SedSample;
import com.imagecube.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Apila las imagenes remuestreadas en un cubo [lambda][y][x] y extrae una SED por pixel.
 */
public class SedAssembler {

    private static final Logger logger = LoggerFactory.getLogger(SedAssembler.class);

    public static final String TABLE_HEADER = "# x, y, wavelength (um), flux units (Jy/pixel)";

    /**
     * @param planes imagenes ya ordenadas por longitud de onda, todas del mismo tamano
     * @throws StageException si los tamanos no coinciden
     */
    public double[][][] buildCube(List<RasterImage> planes, Stage stage) {
        if (planes.isEmpty()) {
            throw new StageException(stage, Stage.DATACUBE_FILE, "no hay imagenes para el cubo");
        }
        int w = planes.get(0).width(), h = planes.get(0).height();
        double[][][] cube = new double[planes.size()][][];
        for (int i = 0; i < planes.size(); i++) {
            RasterImage p = planes.get(i);
            if (p.width() != w || p.height() != h) {
                throw new StageException(stage, Stage.DATACUBE_FILE, String.format(
                        "plano %d de %dx%d, se esperaba %dx%d", i, p.width(), p.height(), w, h));
            }
            cube[i] = p.pixels();
        }
        return cube;
    }

    /** Cabecera del cubo: la de la primera imagen. */
    public ImageHeader cubeHeader(List<RasterImage> planes) {
        return planes.get(0).header().copy();
    }

    /** Una muestra por (plano, pixel), ordenadas por fila, columna y longitud de onda. x = fila, y = columna. */
    public List<SedSample> extract(double[][][] cube, double[] wavelengths) {
        if (cube.length != wavelengths.length) {
            throw new IllegalArgumentException("El cubo tiene " + cube.length + " planos y hay "
                    + wavelengths.length + " longitudes de onda");
        }
        List<SedSample> samples = new ArrayList<>();
        for (int k = 0; k < cube.length; k++) {
            for (int row = 0; row < cube[k].length; row++) {
                for (int col = 0; col < cube[k][row].length; col++) {
                    samples.add(new SedSample(row, col, wavelengths[k], cube[k][row][col]));
                }
            }
        }
        Collections.sort(samples);
        return samples;
    }

    public void writeTable(List<SedSample> samples, Path file) throws IOException {
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write(TABLE_HEADER);
            out.newLine();
            for (SedSample s : samples) {
                out.write(String.format(Locale.US, "%d,%d,%f,%f", s.x(), s.y(), s.wavelength(), s.flux()));
                out.newLine();
            }
        }
        logger.info("Tabla SED: {} ({} filas)", file, samples.size());
    }
}
