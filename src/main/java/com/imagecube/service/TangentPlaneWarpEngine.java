package com.imagecube.service;

import com.imagecube.model.GridSpec;
import com.imagecube.model.RasterImage;
import com.imagecube.model.SkyPosition;
import com.imagecube.model.WcsSolution;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * Reproyeccion TAN -> TAN con interpolacion bilineal de ImageJ.
 * Cada pixel de la rejilla se lleva al cielo y de ahi a la imagen de origen.
 */
public class TangentPlaneWarpEngine implements RegistrationEngine {

    @Override
    public double[][] warp(RasterImage source, GridSpec grid, boolean fluxConserving) {
        WcsSolution src = WcsSolution.fromHeader(source.header())
                .orElseThrow(() -> new IllegalArgumentException("WCS ausente o singular"));
        WcsSolution dst = grid.toWcs();

        int w = source.width(), h = source.height();
        FloatProcessor ip = FloatRasters.toProcessor(source.pixels());
        ip.setInterpolationMethod(ImageProcessor.BILINEAR);

        double ratio = fluxConserving ? dst.pixelArea() / src.pixelArea() : 1.0;

        double[][] out = new double[grid.pixelCountY()][grid.pixelCountX()];
        for (int y = 0; y < out.length; y++) {
            for (int x = 0; x < out[y].length; x++) {
                SkyPosition sky = dst.pixelToWorld(x + 1, y + 1);
                double[] p = src.worldToPixel(sky.ra(), sky.dec());
                if (p == null) {
                    out[y][x] = Double.NaN;
                    continue;
                }
                // FITS (base 1) -> indice de array
                double sx = p[0] - 1, sy = p[1] - 1;
                if (sx < -0.5 || sy < -0.5 || sx > w - 0.5 || sy > h - 0.5) {
                    out[y][x] = Double.NaN;
                    continue;
                }
                out[y][x] = ip.getInterpolatedPixel(Math.max(0, sx), Math.max(0, sy)) * ratio;
            }
        }
        return out;
    }
}
