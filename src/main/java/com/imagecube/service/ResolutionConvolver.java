package com.imagecube.service;

import com.imagecube.model.ImageHeader;
import com.imagecube.model.ImageRecord;
import com.imagecube.model.Instrument;
import com.imagecube.model.PipelineConfig;
import com.imagecube.model.RasterImage;
import com.imagecube.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Lleva todas las imagenes a una resolucion comun (FWHM en arcsec) con un kernel gaussiano
 * calculado a partir de la escala nativa de cada imagen.
 */
public class ResolutionConvolver {

    private static final Logger logger = LoggerFactory.getLogger(ResolutionConvolver.class);

    public static final String FWHM_KEY = "FWHM";
    public static final String FWHM_COMMENT = "The FWHM value used in the convolution step.";

    /** Una fila de la tabla: si el instrumento tiene alguna imagen en [min, max] micron. */
    record BandRule(Instrument instrument, double minMicrons, double maxMicrons, double fwhm) {

        boolean matches(List<ImageRecord> records) {
            for (ImageRecord r : records) {
                double w = r.wavelengthMicrons();
                if (r.instrument() == instrument && w >= minMicrons && w <= maxMicrons) return true;
            }
            return false;
        }
    }

    // Orden = prioridad, gana la primera
    static final List<BandRule> FWHM_TABLE = List.of(
            new BandRule(Instrument.MIPS, 140, 170, 76),
            new BandRule(Instrument.SPIRE, 490, 510, 43),
            new BandRule(Instrument.MIPS, 50, 90, 37),
            new BandRule(Instrument.SPIRE, 300, 400, 30),
            new BandRule(Instrument.SPIRE, 200, 299, 22),
            new BandRule(Instrument.PACS, 140, 180, 18),
            new BandRule(Instrument.MIPS, 18, 30, 13),
            new BandRule(Instrument.PACS, 90, 110, 12.5),
            new BandRule(Instrument.PACS, 60, 80, 10.5));

    private final ConvolutionEngine engine;

    public ResolutionConvolver(ConvolutionEngine engine) {
        this.engine = engine;
    }

    /** FWHM de la tabla para este conjunto de imagenes; 0 si ninguna fila aplica. */
    public double lookupFwhm(List<ImageRecord> records) {
        for (BandRule rule : FWHM_TABLE) {
            if (rule.matches(records)) return rule.fwhm();
        }
        return 0;
    }

    /**
     * FWHM comun: el valor de --fwhm si se dio, si no el de la tabla.
     *
     * @throws CalibrationException si no se puede determinar
     */
    public double requireCommonFwhm(PipelineConfig config, List<ImageRecord> records) {
        if (config.fwhmOverride().isPresent()) {
            double f = config.fwhmOverride().getAsDouble();
            logger.info("FWHM comun indicado por el usuario: {}\"", f);
            return f;
        }
        double f = lookupFwhm(records);
        if (f == 0) {
            throw new CalibrationException("No se pudo determinar un FWHM comun para estas imagenes; usa --fwhm");
        }
        logger.info("FWHM comun: {}\"", f);
        return f;
    }

    public GaussianKernel kernelFor(ImageRecord rec, double fwhm) {
        double scale = rec.nativePixelScale();
        if (!(scale > 0)) {
            throw new StageException(Stage.CONVOLUTION, rec.fileName(), "escala de pixel nativa no valida (" + scale + ")");
        }
        return GaussianKernel.of(GaussianKernel.sigmaFor(fwhm, scale));
    }

    /** Convoluciona y anota el FWHM usado. La imagen de entrada no se modifica. */
    public RasterImage convolve(ImageRecord rec, RasterImage input, double fwhm) {
        GaussianKernel kernel = kernelFor(rec, fwhm);
        double[][] out;
        try {
            out = engine.convolve(input.pixels(), kernel);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new StageException(Stage.CONVOLUTION, rec.fileName(), "Fallo al convolucionar: " + e.getMessage(), e);
        }
        ImageHeader h = input.header().copy();
        h.set(FWHM_KEY, fwhm, FWHM_COMMENT);
        logger.debug("{}: sigma {} px, kernel {}x{}", rec.fileName(), kernel.sigma(), kernel.size(), kernel.size());
        return new RasterImage(out, h);
    }
}
