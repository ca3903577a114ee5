package com.imagecube.model;

/** Posicion en el cielo en grados (J2000). */
public record SkyPosition(double ra, double dec) {
}
