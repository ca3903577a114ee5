package com.imagecube.model;

import java.util.Comparator;

/** Una muestra de SED: flujo (Jy/pixel) de un pixel (x = fila, y = columna del cubo) a una longitud de onda (micron). */
public record SedSample(int x, int y, double wavelength, double flux) implements Comparable<SedSample> {

    private static final Comparator<SedSample> ORDER = Comparator
            .comparingInt(SedSample::x)
            .thenComparingInt(SedSample::y)
            .thenComparingDouble(SedSample::wavelength);

    @Override
    public int compareTo(SedSample o) {
        return ORDER.compare(this, o);
    }
}
