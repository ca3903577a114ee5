package com.imagecube.model;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Instrumentos soportados. Cada uno sabe de donde sacar su escala de pixel nativa
 * y como convertir sus unidades de flujo nativas a Jy/pixel.
 */
public enum Instrument {

    IRAC("IRAC") {
        @Override
        public double nativePixelScale(ImageHeader h) {
            return Math.abs(h.getDouble("PXSCAL1", 0));
        }

        @Override
        public double conversionFactor(ImageHeader h, double wavelengthMicrons) {
            double ps = nativePixelScale(h);
            // MJy/sr -> Jy/pixel
            return MJY_PER_SR_TO_JY_PER_PIXEL * ps * ps;
        }
    },

    MIPS("MIPS") {
        @Override
        public double nativePixelScale(ImageHeader h) {
            return h.getDouble("PLTSCALE", 0);
        }

        @Override
        public double conversionFactor(ImageHeader h, double wavelengthMicrons) {
            double ps = nativePixelScale(h);
            return MJY_PER_SR_TO_JY_PER_PIXEL * ps * ps;
        }
    },

    GALEX("GALEX") {
        @Override
        public double conversionFactor(ImageHeader h, double wavelengthMicrons) {
            double wavelengthAA = wavelengthMicrons * ANGSTROM_PER_MICRON;
            // Comparacion estricta: tolera valores que no son exactamente 1520 / 2310 AA
            double fLambdaCon = (wavelengthAA < 2000) ? FUV_LAMBDA_CON : NUV_LAMBDA_CON;
            return JY_CONVERSION * fLambdaCon * wavelengthAA * wavelengthAA / SPEED_OF_LIGHT_AA_PER_S;
        }
    },

    TWO_MASS("2MASS") {
        @Override
        public double conversionFactor(ImageHeader h, double wavelengthMicrons) {
            double fvega = vegaFlux(h.getString("FILTER"));
            if (fvega == 0 || !h.hasNumber("MAGZP")) return 0;
            // Definicion del sistema de magnitudes
            return fvega * Math.pow(10, -0.4 * h.getDouble("MAGZP"));
        }

        @Override
        public OptionalDouble filterWavelength(String filter) {
            if (filter == null) return OptionalDouble.empty();
            switch (filter.trim().toLowerCase(Locale.ROOT)) {
                case "j": return OptionalDouble.of(WAVELENGTH_2MASS_J);
                case "h": return OptionalDouble.of(WAVELENGTH_2MASS_H);
                case "k":
                case "ks": return OptionalDouble.of(WAVELENGTH_2MASS_KS);
                default: return OptionalDouble.empty();
            }
        }
    },

    PACS("PACS") {
        @Override
        public double conversionFactor(ImageHeader h, double wavelengthMicrons) {
            return 1.0;
        }

        @Override
        public Optional<String> unitWarning(ImageHeader h) {
            String bunit = h.getString("BUNIT");
            if (bunit != null && bunit.equalsIgnoreCase(JY_PER_PIXEL)) return Optional.empty();
            return Optional.of("Instrumento PACS pero BUNIT no es Jy/pixel (" + bunit + "); se usa factor 1.0");
        }

        @Override
        public boolean hasReliablePointing() {
            return true;
        }
    },

    SPIRE("SPIRE") {
        @Override
        public double nativePixelScale(ImageHeader h) {
            return Math.abs(h.getDouble("CDELT2", 0)) * ARCSEC_PER_DEGREE;
        }

        @Override
        public double conversionFactor(ImageHeader h, double wavelengthMicrons) {
            double beam = spireBeamArea(wavelengthMicrons);
            if (beam == 0) return 0;
            double ps = nativePixelScale(h);
            return ps * ps / beam;
        }

        @Override
        public boolean hasReliablePointing() {
            return true;
        }
    },

    /** INSTRUME presente pero desconocido: el usuario debe dar FLUXCONV. */
    UNKNOWN("UNKNOWN") {
        @Override
        public double conversionFactor(ImageHeader h, double wavelengthMicrons) {
            double userFactor = h.getDouble("FLUXCONV", 0);
            return userFactor > 0 ? userFactor : 0;
        }
    };

    public static final String JY_PER_PIXEL = "Jy/pixel";
    public static final double ARCSEC_PER_DEGREE = 3600.0;
    public static final double ANGSTROM_PER_MICRON = 1.0e4;

    // Spitzer (IRAC, MIPS): MJy/sr -> Jy/(arcsec^2)
    public static final double MJY_PER_SR_TO_JY_PER_PIXEL = 2.3504e-5;
    // GALEX CPS -> erg s-1 cm-2 AA-1
    public static final double FUV_LAMBDA_CON = 1.40e-15;
    public static final double NUV_LAMBDA_CON = 2.06e-16;
    // erg s-1 cm-2 Hz-1 -> Jy
    public static final double JY_CONVERSION = 1.0e23;
    public static final double SPEED_OF_LIGHT_AA_PER_S = 2.99792458e18;

    public static final double FVEGA_J = 1594;
    public static final double FVEGA_H = 1024;
    public static final double FVEGA_KS = 666.7;

    public static final double WAVELENGTH_2MASS_J = 1.2409;
    public static final double WAVELENGTH_2MASS_H = 1.6514;
    public static final double WAVELENGTH_2MASS_KS = 2.1656;

    // SPIRE Observer's Manual v2.4 (arcsec^2)
    public static final double S250_BEAM_AREA = 423;
    public static final double S350_BEAM_AREA = 751;
    public static final double S500_BEAM_AREA = 1587;

    private final String label;

    Instrument(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Escala de pixel nativa en arcsec; 0 si no se encuentra. */
    public double nativePixelScale(ImageHeader h) {
        return Math.abs(h.getDouble("CDELT2", 0)) * ARCSEC_PER_DEGREE;
    }

    /** Factor que lleva las unidades nativas a Jy/pixel; 0 significa que no se pudo calibrar. */
    public abstract double conversionFactor(ImageHeader h, double wavelengthMicrons);

    /** Longitud de onda (micron) de un nombre de filtro, si el instrumento tiene tabla. */
    public OptionalDouble filterWavelength(String filter) {
        return OptionalDouble.empty();
    }

    public Optional<String> unitWarning(ImageHeader h) {
        return Optional.empty();
    }

    /** Solo Herschel (PACS, SPIRE) tiene apuntado fiable para calcular la posicion de referencia. */
    public boolean hasReliablePointing() {
        return false;
    }

    /** Valor de INSTRUME -> instrumento; cualquier otro valor es UNKNOWN. */
    public static Instrument fromKeyword(String value) {
        if (value == null) return UNKNOWN;
        String v = value.trim().toUpperCase(Locale.ROOT);
        for (Instrument i : values()) {
            if (i != UNKNOWN && i.label.equals(v)) return i;
        }
        return UNKNOWN;
    }

    static double vegaFlux(String filter) {
        if (filter == null) return 0;
        switch (filter.trim().toLowerCase(Locale.ROOT)) {
            case "j": return FVEGA_J;
            case "h": return FVEGA_H;
            case "k":
            case "ks": return FVEGA_KS;
            default: return 0;
        }
    }

    static double spireBeamArea(double wavelengthMicrons) {
        if (Math.abs(wavelengthMicrons - 250) < 1e-6) return S250_BEAM_AREA;
        if (Math.abs(wavelengthMicrons - 350) < 1e-6) return S350_BEAM_AREA;
        if (Math.abs(wavelengthMicrons - 500) < 1e-6) return S500_BEAM_AREA;
        return 0;
    }
}
