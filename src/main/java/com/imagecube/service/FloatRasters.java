package com.imagecube.service;

import ij.process.FloatProcessor;

/** Conversion double[y][x] <-> FloatProcessor de ImageJ. */
final class FloatRasters {

    private FloatRasters() {
    }

    static FloatProcessor toProcessor(double[][] data) {
        int height = data.length, width = data[0].length;
        FloatProcessor ip = new FloatProcessor(width, height);
        float[] px = (float[]) ip.getPixels();
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++)
                px[y * width + x] = (float) data[y][x];
        return ip;
    }

    static double[][] toArray(FloatProcessor ip) {
        int width = ip.getWidth(), height = ip.getHeight();
        float[] px = (float[]) ip.getPixels();
        double[][] d = new double[height][width];
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++)
                d[y][x] = px[y * width + x];
        return d;
    }
}
