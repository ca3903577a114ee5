package com.imagecube.service;

import com.imagecube.model.GridSpec;
import com.imagecube.model.ImageRecord;
import com.imagecube.model.PipelineConfig;
import com.imagecube.model.RasterImage;
import com.imagecube.model.SkyPosition;
import com.imagecube.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Remuestreo de todas las imagenes convolucionadas a una unica rejilla comun. */
public class ResamplingService {

    private static final Logger logger = LoggerFactory.getLogger(ResamplingService.class);

    /** Pixeles por elemento de resolucion. */
    public static final double NYQUIST_SAMPLING_RATE = 3.3;

    private final GridBuilder grids;
    private final WcsRegistrationService registration;

    public ResamplingService(GridBuilder grids, WcsRegistrationService registration) {
        this.grids = grids;
        this.registration = registration;
    }

    public static double pixelScale(double commonFwhm) {
        return commonFwhm / NYQUIST_SAMPLING_RATE;
    }

    /**
     * Rejilla compartida por todas las imagenes.
     *
     * @throws ConfigurationException si el tamano angular no cubre ni un pixel
     */
    public GridSpec sharedGrid(PipelineConfig config, double commonFwhm, SkyPosition reference) {
        double scale = pixelScale(commonFwhm);
        GridSpec grid;
        try {
            grid = grids.build(config.angularSize(), scale, reference);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        logger.info("Rejilla de remuestreo: {}x{} px a {}\"/px", grid.pixelCountX(), grid.pixelCountY(), scale);
        return grid;
    }

    /** Reproyeccion con conservacion de flujo sobre la rejilla compartida. */
    public RasterImage resample(ImageRecord rec, RasterImage convolved, GridSpec grid) {
        return registration.warp(Stage.RESAMPLING, rec.fileName(), convolved, grid, true);
    }
}
