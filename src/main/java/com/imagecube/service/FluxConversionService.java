package com.imagecube.service;

import com.imagecube.model.ConversionFactorRow;
import com.imagecube.model.ImageHeader;
import com.imagecube.model.ImageRecord;
import com.imagecube.model.Instrument;
import com.imagecube.model.RasterImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** Convierte las unidades de flujo nativas de cada imagen a Jy/pixel. */
public class FluxConversionService {

    private static final Logger logger = LoggerFactory.getLogger(FluxConversionService.class);

    public static final String FACTOR_KEY = "JYPXFACT";
    public static final String FACTOR_COMMENT = "Factor to convert original BUNIT into Jy/pixel.";

    /** Factor tal cual lo da la formula del instrumento; 0 = no calibrable. */
    public double factorFor(ImageRecord rec) {
        return rec.instrument().conversionFactor(rec.header(), rec.wavelengthMicrons());
    }

    /**
     * Multiplica cada pixel por el factor y anota BUNIT y JYPXFACT en el header.
     *
     * @throws CalibrationException si el factor es 0 (o no es un numero valido)
     */
    public RasterImage apply(ImageRecord rec, RasterImage input) {
        double factor = factorFor(rec);
        if (!(factor > 0) || Double.isInfinite(factor)) {
            throw new CalibrationException(rec.fileName() + ": factor de conversion a Jy/pixel invalido (" + factor
                    + ") para " + rec.instrument().label()
                    + (rec.instrument() == Instrument.UNKNOWN ? "; agrega FLUXCONV al header" : ""));
        }
        rec.instrument().unitWarning(input.header())
                .ifPresent(w -> logger.warn("{}: {}", rec.fileName(), w));

        double[][] px = input.pixels();
        for (double[] row : px) {
            for (int x = 0; x < row.length; x++) row[x] *= factor;
        }
        ImageHeader h = input.header();
        h.set("BUNIT", Instrument.JY_PER_PIXEL, null);
        h.set(FACTOR_KEY, factor, FACTOR_COMMENT);

        logger.info("{}: factor {} -> Jy/pixel", rec.fileName(), factor);
        return input;
    }

    /** Informe instrumento / longitud de onda / factor, sin abortar en factores 0. */
    public List<ConversionFactorRow> report(List<ImageRecord> records) {
        List<ConversionFactorRow> rows = new ArrayList<>();
        for (ImageRecord r : records) {
            rows.add(new ConversionFactorRow(r.fileName(), r.instrument(), r.wavelengthMicrons(), factorFor(r)));
        }
        return rows;
    }
}
