package com.imagecube.model;

/**
 * Geometria de la rejilla sintetica sobre la que se reproyectan las imagenes.
 * Escalas en arcsec/pixel, referencia en grados.
 */
public record GridSpec(int pixelCountX, int pixelCountY,
                       double pixelScaleX, double pixelScaleY,
                       double referenceRa, double referenceDec,
                       String projection, String referenceEpoch) {

    public static final String TAN = "tan";
    public static final String J2000 = "j2000";

    public static GridSpec square(int pixelCount, double pixelScale, SkyPosition reference) {
        return new GridSpec(pixelCount, pixelCount, pixelScale, pixelScale,
                reference.ra(), reference.dec(), TAN, J2000);
    }

    /** CRPIX1 (convencion FITS, base 1): la mitad del numero de columnas. */
    public double referencePixelX() {
        return pixelCountX / 2.0;
    }

    public double referencePixelY() {
        return pixelCountY / 2.0;
    }

    /** Rotacion cero, RA crece hacia la izquierda. */
    public WcsSolution toWcs() {
        return WcsSolution.fromScale(referenceRa, referenceDec, referencePixelX(), referencePixelY(),
                -pixelScaleX / Instrument.ARCSEC_PER_DEGREE, pixelScaleY / Instrument.ARCSEC_PER_DEGREE);
    }
}
