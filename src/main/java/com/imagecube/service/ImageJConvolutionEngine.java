package com.imagecube.service;

import ij.plugin.filter.Convolver;
import ij.process.FloatProcessor;

/** Convolucion con {@link Convolver} de ImageJ sobre un FloatProcessor. */
public class ImageJConvolutionEngine implements ConvolutionEngine {

    @Override
    public double[][] convolve(double[][] pixels, GaussianKernel kernel) {
        FloatProcessor ip = FloatRasters.toProcessor(pixels);
        Convolver convolver = new Convolver();
        convolver.setNormalize(true);
        if (!convolver.convolve(ip, kernel.values(), kernel.size(), kernel.size())) {
            throw new IllegalStateException("Convolucion cancelada");
        }
        return FloatRasters.toArray(ip);
    }
}
