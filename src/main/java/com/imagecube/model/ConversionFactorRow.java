package com.imagecube.model;

import java.util.Locale;

/** Una fila del informe de factores de conversion. */
public record ConversionFactorRow(String fileName, Instrument instrument, double wavelengthMicrons, double factor) {

    public static final String HEADER = "Instrument\tWavelength\tConversion factor (to Jy/pixel)";

    public String format() {
        return String.format(Locale.US, "%s\t%s\t%s", instrument.label(), wavelengthMicrons, factor);
    }
}
