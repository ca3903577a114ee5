package com.imagecube.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Unidad de trabajo del pipeline: una imagen de entrada con su instrumento,
 * longitud de onda y escala nativa ya resueltos.
 */
public class ImageRecord {

    private final Path sourcePath;
    private final String stem;
    private final Instrument instrument;
    private final Wavelength wavelength;
    private final double nativePixelScale;
    private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());
    private RasterImage image;
    private Stage currentStage;

    public ImageRecord(Path sourcePath, RasterImage image, Instrument instrument,
                       Wavelength wavelength, double nativePixelScale) {
        this.sourcePath = sourcePath;
        this.stem = stemOf(sourcePath);
        this.image = image;
        this.instrument = instrument;
        this.wavelength = wavelength;
        this.nativePixelScale = nativePixelScale;
    }

    public Path sourcePath() { return sourcePath; }
    public String stem() { return stem; }
    public String fileName() { return sourcePath.getFileName().toString(); }
    public Instrument instrument() { return instrument; }
    public Wavelength wavelength() { return wavelength; }
    public double wavelengthMicrons() { return wavelength.microns(); }
    public double nativePixelScale() { return nativePixelScale; }
    public ImageHeader header() { return image.header(); }

    public RasterImage image() { return image; }

    /** Etapa que produjo la imagen en memoria; null = imagen original. */
    public Stage currentStage() { return currentStage; }

    public void setImage(RasterImage image, Stage producedBy) {
        this.image = image;
        this.currentStage = producedBy;
    }

    public void addWarning(String w) { warnings.add(w); }
    public List<String> warnings() { return List.copyOf(warnings); }

    /** Nombre sin la extension .fit/.fits */
    public static String stemOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    @Override
    public String toString() {
        return String.format("%s [%s %.4f um]", fileName(), instrument.label(), wavelength.microns());
    }
}
