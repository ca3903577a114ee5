package com.imagecube.model;

/** Array 2-D [y][x] mas su header: lo que se lee y escribe en disco en cada etapa. */
public record RasterImage(double[][] pixels, ImageHeader header) {

    public int width() {
        return pixels.length == 0 ? 0 : pixels[0].length;
    }

    public int height() {
        return pixels.length;
    }
}
