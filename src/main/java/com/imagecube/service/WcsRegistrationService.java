package com.imagecube.service;

import com.imagecube.model.GridSpec;
import com.imagecube.model.ImageHeader;
import com.imagecube.model.RasterImage;
import com.imagecube.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adaptador hacia el motor de registro: prepara la cabecera de la rejilla sintetica
 * y delega la reproyeccion. No mira el contenido de los pixeles.
 */
public class WcsRegistrationService {

    private static final Logger logger = LoggerFactory.getLogger(WcsRegistrationService.class);

    private final RegistrationEngine engine;

    public WcsRegistrationService(RegistrationEngine engine) {
        this.engine = engine;
    }

    /** Cabecera de la imagen original con el WCS de la rejilla (TAN, J2000, sin rotacion). */
    public ImageHeader gridHeader(ImageHeader source, GridSpec grid) {
        ImageHeader h = source.copy();
        grid.toWcs().writeTo(h);
        return h;
    }

    /**
     * Lleva la imagen a la rejilla.
     *
     * @param stage etapa que pide el registro, solo para el contexto del error
     * @throws StageException si el motor falla para esta imagen
     */
    public RasterImage warp(Stage stage, String fileName, RasterImage source, GridSpec grid, boolean fluxConserving) {
        double[][] pixels;
        try {
            pixels = engine.warp(source, grid, fluxConserving);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new StageException(stage, fileName, "Fallo al reproyectar: " + e.getMessage(), e);
        }
        if (pixels == null || pixels.length != grid.pixelCountY() || pixels[0].length != grid.pixelCountX()) {
            throw new StageException(stage, fileName, "El motor de registro devolvio una imagen de tamano incorrecto");
        }
        logger.debug("{}: {}x{} px a {}\"/px (conserva flujo: {})", fileName,
                grid.pixelCountX(), grid.pixelCountY(), grid.pixelScaleX(), fluxConserving);
        return new RasterImage(pixels, gridHeader(source.header(), grid));
    }
}
