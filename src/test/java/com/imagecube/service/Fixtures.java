package com.imagecube.service;

import com.imagecube.model.ImageHeader;
import com.imagecube.model.ImageRecord;
import com.imagecube.model.Instrument;
import com.imagecube.model.RasterImage;
import com.imagecube.model.Wavelength;

import java.nio.file.Path;
import java.nio.file.Paths;

/** Headers e imagenes sinteticas para los tests. */
final class Fixtures {

    static final double RA = 150.0;
    static final double DEC = 2.0;

    private Fixtures() {
    }

    static ImageHeader header(Object... keyValues) {
        ImageHeader h = new ImageHeader();
        for (int i = 0; i < keyValues.length; i += 2) h.set((String) keyValues[i], keyValues[i + 1], null);
        return h;
    }

    /** WCS TAN centrado en (RA, DEC), sin rotacion. */
    static ImageHeader withTan(ImageHeader h, int width, int height, double scaleArcsec) {
        h.set("CTYPE1", "RA---TAN", null);
        h.set("CTYPE2", "DEC--TAN", null);
        h.set("CRVAL1", RA, null);
        h.set("CRVAL2", DEC, null);
        h.set("CRPIX1", (width + 1) / 2.0, null);
        h.set("CRPIX2", (height + 1) / 2.0, null);
        h.set("CDELT1", -scaleArcsec / 3600, null);
        h.set("CDELT2", scaleArcsec / 3600, null);
        return h;
    }

    static double[][] constant(int width, int height, double value) {
        double[][] d = new double[height][width];
        for (double[] row : d) java.util.Arrays.fill(row, value);
        return d;
    }

    static RasterImage image(int width, int height, double value, ImageHeader h) {
        return new RasterImage(constant(width, height, value), h);
    }

    static ImageRecord record(String file, Instrument instrument, double microns, double scale, ImageHeader h) {
        Path p = Paths.get(file);
        Wavelength w = new Wavelength(microns, "micron", microns, true, "WAVELENG");
        return new ImageRecord(p, new RasterImage(constant(4, 4, 1.0), h), instrument, w, scale);
    }

    static ImageRecord record(String file, Instrument instrument, double microns) {
        return record(file, instrument, microns, 1.0, new ImageHeader());
    }

    /** Imagen IRAC 8 micron, 1.2"/px, en MJy/sr. */
    static RasterImage irac(int size, double value) {
        ImageHeader h = header("INSTRUME", "IRAC", "PXSCAL1", -1.2, "BUNIT", "MJy/sr");
        h.set("WAVELENG", 8.0, "micron");
        return image(size, size, value, withTan(h, size, size, 1.2));
    }

    /** Imagen MIPS 24 micron, 2.45"/px. */
    static RasterImage mips(int size, double value) {
        ImageHeader h = header("INSTRUME", "MIPS", "PLTSCALE", 2.45, "BUNIT", "MJy/sr");
        h.set("WAVELENG", 24.0, "micron");
        return image(size, size, value, withTan(h, size, size, 2.45));
    }

    /** Imagen SPIRE 250 micron, 6"/px. */
    static RasterImage spire(int size, double value) {
        ImageHeader h = header("INSTRUME", "SPIRE", "BUNIT", "Jy/beam");
        h.set("WAVELENG", 250.0, "micron");
        return image(size, size, value, withTan(h, size, size, 6.0));
    }
}
