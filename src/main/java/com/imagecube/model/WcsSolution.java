package com.imagecube.model;

import java.util.List;
import java.util.Optional;

/**
 * WCS lineal con proyeccion gnomonica (TAN).
 * Pixeles en convencion FITS (el centro del primer pixel es 1.0), angulos en grados.
 */
public final class WcsSolution {

    private static final List<String> WCS_KEYS = List.of(
            "CTYPE1", "CTYPE2", "CUNIT1", "CUNIT2", "CRVAL1", "CRVAL2", "CRPIX1", "CRPIX2",
            "CDELT1", "CDELT2", "CD1_1", "CD1_2", "CD2_1", "CD2_2",
            "PC1_1", "PC1_2", "PC2_1", "PC2_2", "CROTA1", "CROTA2",
            "LONPOLE", "LATPOLE", "EQUINOX", "EPOCH", "RADESYS");

    private final double crval1, crval2;
    private final double crpix1, crpix2;
    private final double cd11, cd12, cd21, cd22;
    private final double det;

    private WcsSolution(double crval1, double crval2, double crpix1, double crpix2,
                        double cd11, double cd12, double cd21, double cd22) {
        this.crval1 = crval1;
        this.crval2 = crval2;
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.cd11 = cd11;
        this.cd12 = cd12;
        this.cd21 = cd21;
        this.cd22 = cd22;
        this.det = cd11 * cd22 - cd12 * cd21;
    }

    public static WcsSolution fromScale(double ra, double dec, double crpix1, double crpix2,
                                        double cdelt1, double cdelt2) {
        return new WcsSolution(ra, dec, crpix1, crpix2, cdelt1, 0, 0, cdelt2);
    }

    public static WcsSolution fromMatrix(double ra, double dec, double crpix1, double crpix2,
                                         double cd11, double cd12, double cd21, double cd22) {
        return new WcsSolution(ra, dec, crpix1, crpix2, cd11, cd12, cd21, cd22);
    }

    /**
     * Lee CRVAL/CRPIX y la matriz CD, o CDELT con PC o CROTA2.
     * Vacio si faltan claves o la matriz es singular.
     */
    public static Optional<WcsSolution> fromHeader(ImageHeader h) {
        if (!h.hasNumber("CRVAL1") || !h.hasNumber("CRVAL2") || !h.hasNumber("CRPIX1") || !h.hasNumber("CRPIX2")) {
            return Optional.empty();
        }
        double ra = h.getDouble("CRVAL1"), dec = h.getDouble("CRVAL2");
        double px = h.getDouble("CRPIX1"), py = h.getDouble("CRPIX2");
        WcsSolution wcs;
        if (h.hasNumber("CD1_1") || h.hasNumber("CD2_2")) {
            wcs = new WcsSolution(ra, dec, px, py,
                    h.getDouble("CD1_1", 0), h.getDouble("CD1_2", 0),
                    h.getDouble("CD2_1", 0), h.getDouble("CD2_2", 0));
        } else if (h.hasNumber("CDELT1") && h.hasNumber("CDELT2")) {
            double c1 = h.getDouble("CDELT1"), c2 = h.getDouble("CDELT2");
            if (h.hasNumber("PC1_1") || h.hasNumber("PC2_2")) {
                wcs = new WcsSolution(ra, dec, px, py,
                        c1 * h.getDouble("PC1_1", 1), c1 * h.getDouble("PC1_2", 0),
                        c2 * h.getDouble("PC2_1", 0), c2 * h.getDouble("PC2_2", 1));
            } else {
                double rho = Math.toRadians(h.getDouble("CROTA2", 0));
                double cos = Math.cos(rho), sin = Math.sin(rho);
                wcs = new WcsSolution(ra, dec, px, py, c1 * cos, -c2 * sin, c1 * sin, c2 * cos);
            }
        } else {
            return Optional.empty();
        }
        return wcs.isSingular() ? Optional.empty() : Optional.of(wcs);
    }

    public boolean isSingular() {
        return det == 0 || Double.isNaN(det);
    }

    /** Area de un pixel en grados cuadrados. */
    public double pixelArea() {
        return Math.abs(det);
    }

    public SkyPosition pixelToWorld(double x, double y) {
        double dx = x - crpix1, dy = y - crpix2;
        double xi = Math.toRadians(cd11 * dx + cd12 * dy);
        double eta = Math.toRadians(cd21 * dx + cd22 * dy);
        double ra0 = Math.toRadians(crval1), dec0 = Math.toRadians(crval2);

        double den = Math.cos(dec0) - eta * Math.sin(dec0);
        double ra = ra0 + Math.atan2(xi, den);
        double dec = Math.atan2(Math.sin(dec0) + eta * Math.cos(dec0), Math.hypot(xi, den));

        double raDeg = Math.toDegrees(ra) % 360.0;
        if (raDeg < 0) raDeg += 360.0;
        return new SkyPosition(raDeg, Math.toDegrees(dec));
    }

    /** Null si el punto queda en el hemisferio opuesto al punto tangente. */
    public double[] worldToPixel(double ra, double dec) {
        double ra0 = Math.toRadians(crval1), dec0 = Math.toRadians(crval2);
        double a = Math.toRadians(ra), d = Math.toRadians(dec);
        double dra = a - ra0;

        double cosc = Math.sin(dec0) * Math.sin(d) + Math.cos(dec0) * Math.cos(d) * Math.cos(dra);
        if (cosc <= 0) return null;
        double xi = Math.toDegrees(Math.cos(d) * Math.sin(dra) / cosc);
        double eta = Math.toDegrees((Math.cos(dec0) * Math.sin(d) - Math.sin(dec0) * Math.cos(d) * Math.cos(dra)) / cosc);

        double dx = (cd22 * xi - cd12 * eta) / det;
        double dy = (-cd21 * xi + cd11 * eta) / det;
        return new double[]{dx + crpix1, dy + crpix2};
    }

    /** Reemplaza cualquier WCS previo del header por este. */
    public void writeTo(ImageHeader h) {
        stripFrom(h);
        h.set("CTYPE1", "RA---TAN", "Proyeccion gnomonica");
        h.set("CTYPE2", "DEC--TAN", "Proyeccion gnomonica");
        h.set("CRVAL1", crval1, "RA de referencia (deg)");
        h.set("CRVAL2", crval2, "DEC de referencia (deg)");
        h.set("CRPIX1", crpix1, "Pixel de referencia X");
        h.set("CRPIX2", crpix2, "Pixel de referencia Y");
        if (cd12 == 0 && cd21 == 0) {
            h.set("CDELT1", cd11, "Escala X (deg/pixel)");
            h.set("CDELT2", cd22, "Escala Y (deg/pixel)");
        } else {
            h.set("CD1_1", cd11, null);
            h.set("CD1_2", cd12, null);
            h.set("CD2_1", cd21, null);
            h.set("CD2_2", cd22, null);
        }
        h.set("EQUINOX", 2000.0, "J2000");
        h.set("RADESYS", "FK5", null);
    }

    public static void stripFrom(ImageHeader h) {
        for (String k : WCS_KEYS) h.remove(k);
    }

    public double referenceRa() {
        return crval1;
    }

    public double referenceDec() {
        return crval2;
    }
}
