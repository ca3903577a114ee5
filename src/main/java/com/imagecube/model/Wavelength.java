package com.imagecube.model;

/**
 * Longitud de onda resuelta de una imagen.
 *
 * @param value        valor tal cual aparece en el header
 * @param unit         unidad declarada
 * @param microns      valor normalizado a micron
 * @param unitVerified false cuando la unidad no se reconocio y {@code microns} es el valor provisional 1.0
 * @param keyword      clave de la que salio el valor
 */
public record Wavelength(double value, String unit, double microns, boolean unitVerified, String keyword) {
}
