package com.imagecube.service;

/** Motor de convolucion 2-D. */
public interface ConvolutionEngine {

    /** Devuelve una imagen nueva del mismo tamano; la de entrada no se modifica. */
    double[][] convolve(double[][] pixels, GaussianKernel kernel);
}
