package com.imagecube.service;

/**
 * Kernel gaussiano 2-D cuadrado, de lado impar y normalizado a suma 1.
 * Los valores estan por filas (el formato que espera ImageJ).
 */
public final class GaussianKernel {

    private final double sigma;
    private final int size;
    private final float[] values;

    private GaussianKernel(double sigma, int size, float[] values) {
        this.sigma = sigma;
        this.size = size;
        this.values = values;
    }

    /** Lado = 2*ceil(4*sigma)+1, minimo 3. */
    public static GaussianKernel of(double sigma) {
        if (!(sigma > 0) || Double.isInfinite(sigma)) {
            throw new IllegalArgumentException("Sigma no valida: " + sigma);
        }
        int half = Math.max(1, (int) Math.ceil(4 * sigma));
        int size = 2 * half + 1;
        double[] raw = new double[size * size];
        double sum = 0;
        for (int y = -half; y <= half; y++) {
            for (int x = -half; x <= half; x++) {
                double v = Math.exp(-(x * x + y * y) / (2 * sigma * sigma));
                raw[(y + half) * size + (x + half)] = v;
                sum += v;
            }
        }
        float[] values = new float[raw.length];
        for (int i = 0; i < raw.length; i++) values[i] = (float) (raw[i] / sum);
        return new GaussianKernel(sigma, size, values);
    }

    /** sigma en pixeles = FWHM / (2*sqrt(2*ln2) * escala). */
    public static double sigmaFor(double fwhmArcsec, double pixelScaleArcsec) {
        return fwhmArcsec / (2 * Math.sqrt(2 * Math.log(2)) * pixelScaleArcsec);
    }

    public double sigma() { return sigma; }

    public int size() { return size; }

    public float[] values() { return values.clone(); }

    public double sum() {
        double s = 0;
        for (float v : values) s += v;
        return s;
    }
}
