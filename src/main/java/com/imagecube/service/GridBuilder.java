package com.imagecube.service;

import com.imagecube.model.GridSpec;
import com.imagecube.model.ImageHeader;
import com.imagecube.model.ImageRecord;
import com.imagecube.model.PipelineConfig;
import com.imagecube.model.SkyPosition;
import com.imagecube.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Geometria de las rejillas sinteticas: tamano en pixeles para cubrir el tamano angular pedido
 * y posicion de referencia en el cielo.
 */
public class GridBuilder {

    private static final Logger logger = LoggerFactory.getLogger(GridBuilder.class);

    /** Tolerancia relativa del cociente: CDELT en decimal deja ruido tras pasar de grados a arcsec. */
    static final double RATIO_TOLERANCE = 1e-9;

    /** floor(angularSize / pixelScale); el mismo entero da el centro (pixelCount / 2). */
    public static int pixelCount(double angularSize, double pixelScale) {
        if (!(pixelScale > 0)) throw new IllegalArgumentException("Escala de pixel no valida: " + pixelScale);
        double ratio = angularSize / pixelScale;
        return (int) Math.floor(ratio + RATIO_TOLERANCE * Math.max(1.0, Math.abs(ratio)));
    }

    /** Rejilla cuadrada que cubre {@code angularSize} arcsec a {@code pixelScale} arcsec/pixel. */
    public GridSpec build(double angularSize, double pixelScale, SkyPosition reference) {
        int n = pixelCount(angularSize, pixelScale);
        if (n < 1) {
            throw new IllegalArgumentException(String.format(
                    "El tamano angular %.3f\" no cubre ni un pixel de %.3f\"", angularSize, pixelScale));
        }
        return GridSpec.square(n, pixelScale, reference);
    }

    /** Rejilla de registro de una imagen: su propia escala nativa. */
    public GridSpec forRegistration(PipelineConfig config, ImageRecord rec, SkyPosition reference) {
        try {
            return build(config.angularSize(), rec.nativePixelScale(), reference);
        } catch (IllegalArgumentException e) {
            throw new StageException(Stage.REGISTRATION, rec.fileName(), e.getMessage(), e);
        }
    }

    /**
     * RA/DEC de referencia, eje por eje: valor explicito, si no CRVAL de la imagen de referencia,
     * si no la media de CRVAL sobre las imagenes Herschel (PACS, SPIRE).
     *
     * @param referenceHeader header de la imagen de referencia del usuario, o null
     * @throws CalibrationException si hay que usar la media Herschel y no hay imagenes Herschel
     */
    public SkyPosition referencePosition(PipelineConfig config, List<ImageRecord> records, ImageHeader referenceHeader) {
        double ra = axis(config.raOverride(), referenceHeader, "CRVAL1", records);
        double dec = axis(config.decOverride(), referenceHeader, "CRVAL2", records);
        SkyPosition p = new SkyPosition(ra, dec);
        logger.info("Posicion de referencia: RA {} DEC {}", ra, dec);
        return p;
    }

    private double axis(OptionalDouble explicit, ImageHeader referenceHeader, String key, List<ImageRecord> records) {
        if (explicit.isPresent()) return explicit.getAsDouble();
        if (referenceHeader != null && referenceHeader.hasNumber(key)) return referenceHeader.getDouble(key);
        return herschelMean(records, key);
    }

    /** Media de la clave sobre las imagenes con apuntado fiable (PACS, SPIRE). */
    public double herschelMean(List<ImageRecord> records, String key) {
        double sum = 0;
        int n = 0;
        for (ImageRecord r : records) {
            if (!r.instrument().hasReliablePointing()) continue;
            double v = r.header().getDouble(key);
            if (Double.isNaN(v)) {
                throw new CalibrationException(r.fileName() + ": imagen Herschel sin " + key);
            }
            sum += v;
            n++;
        }
        if (n == 0) {
            throw new CalibrationException("No hay imagenes PACS/SPIRE para calcular " + key
                    + "; indica --ra/--dec o --reference_image");
        }
        return sum / n;
    }
}
