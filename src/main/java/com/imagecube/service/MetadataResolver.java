package com.imagecube.service;

import com.imagecube.model.ImageHeader;
import com.imagecube.model.ImageRecord;
import com.imagecube.model.Instrument;
import com.imagecube.model.RasterImage;
import com.imagecube.model.Wavelength;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Identifica instrumento, longitud de onda y escala de pixel nativa a partir del header.
 */
public class MetadataResolver {

    private static final Logger logger = LoggerFactory.getLogger(MetadataResolver.class);

    public static final String MICRON = "micron";
    /** Valor provisional cuando la unidad de longitud de onda no se reconoce. No es un dato real. */
    public static final double PLACEHOLDER_MICRONS = 1.0;

    private static final Set<String> MICRON_NAMES = Set.of("micron", "microns", "um", "µm", "micrometer", "micrometers", "micrometre", "micrometres");
    private static final Set<String> ANGSTROM_NAMES = Set.of("aa", "angstrom", "angstroms", "å");
    private static final double MICRON_PER_ANGSTROM = 1.0e-4;

    /** Crea el registro de una imagen recien leida. Reescribe WAVELENG en micron. */
    public ImageRecord resolve(Path source, RasterImage image) {
        String fileName = source.getFileName().toString();
        ImageHeader h = image.header();

        Instrument instrument = resolveInstrument(h, fileName);
        Wavelength wavelength = resolveWavelength(h, instrument, fileName);
        double scale = nativePixelScale(h, instrument, fileName);

        h.set("WAVELENG", wavelength.microns(), MICRON);
        ImageRecord rec = new ImageRecord(source, image, instrument, wavelength, scale);
        if (!wavelength.unitVerified()) {
            rec.addWarning("Unidad de longitud de onda no reconocida '" + wavelength.unit()
                    + "'; se usa el valor provisional " + PLACEHOLDER_MICRONS + " micron");
        }
        if (scale == 0) rec.addWarning("Escala de pixel nativa 0");
        instrument.unitWarning(h).ifPresent(rec::addWarning);

        logger.debug("{} -> {} {} um, {} arcsec/pixel", fileName, instrument.label(), wavelength.microns(), scale);
        return rec;
    }

    /**
     * INSTRUME; si no, INF0001 que contenga "galex"; si no, ORIGIN que contenga "2MASS".
     *
     * @throws CalibrationException si ninguna clave identifica el instrumento
     */
    public Instrument resolveInstrument(ImageHeader h, String fileName) {
        if (h.contains("INSTRUME")) {
            Instrument i = Instrument.fromKeyword(h.getString("INSTRUME"));
            if (i == Instrument.UNKNOWN) {
                logger.warn("{}: instrumento '{}' no soportado; se necesita FLUXCONV", fileName, h.getString("INSTRUME"));
            }
            return i;
        }
        String mission = h.getString("INF0001");
        if (mission != null && mission.toLowerCase(Locale.ROOT).contains("galex")) return Instrument.GALEX;
        String origin = h.getString("ORIGIN");
        if (origin != null && origin.toUpperCase(Locale.ROOT).contains("2MASS")) return Instrument.TWO_MASS;

        throw new CalibrationException(fileName + ": no se pudo determinar el instrumento; "
                + "agrega INSTRUME (o INF0001 / ORIGIN) al header");
    }

    /**
     * WAVELENG (unidad en el comentario); si no, WAVELNTH en micron; si no, FILTER por tabla del instrumento.
     *
     * @throws CalibrationException si no hay longitud de onda utilizable
     */
    public Wavelength resolveWavelength(ImageHeader h, Instrument instrument, String fileName) {
        if (h.contains("WAVELENG")) {
            double v = requireNumber(h, "WAVELENG", fileName);
            return toMicrons(v, h.getComment("WAVELENG"), "WAVELENG", fileName);
        }
        if (h.contains("WAVELNTH")) {
            double v = requireNumber(h, "WAVELNTH", fileName);
            return new Wavelength(v, MICRON, v, true, "WAVELNTH");
        }
        if (h.contains("FILTER")) {
            String filter = h.getString("FILTER");
            OptionalDouble w = instrument.filterWavelength(filter);
            if (w.isPresent()) return new Wavelength(w.getAsDouble(), MICRON, w.getAsDouble(), true, "FILTER");
            throw new CalibrationException(fileName + ": filtro '" + filter + "' sin longitud de onda conocida para "
                    + instrument.label());
        }
        throw new CalibrationException(fileName + ": sin longitud de onda (WAVELENG, WAVELNTH o FILTER)");
    }

    /** micron y angstrom; cualquier otra unidad da el valor provisional marcado como no verificado. */
    public Wavelength toMicrons(double value, String unit, String keyword, String fileName) {
        String u = normalizeUnit(unit);
        if (MICRON_NAMES.contains(u)) return new Wavelength(value, unit, value, true, keyword);
        if (ANGSTROM_NAMES.contains(u)) return new Wavelength(value, unit, value * MICRON_PER_ANGSTROM, true, keyword);

        logger.warn("{}: unidad de longitud de onda '{}' no reconocida; usando {} micron (valor provisional)",
                fileName, unit, PLACEHOLDER_MICRONS);
        return new Wavelength(value, unit, PLACEHOLDER_MICRONS, false, keyword);
    }

    /** arcsec/pixel; 0 (con aviso) si no se encuentra. */
    public double nativePixelScale(ImageHeader h, Instrument instrument, String fileName) {
        double scale = instrument.nativePixelScale(h);
        if (scale == 0) {
            logger.warn("{}: la escala de pixel nativa es 0; algo puede estar mal en el header", fileName);
        }
        return scale;
    }

    private static double requireNumber(ImageHeader h, String key, String fileName) {
        double v = h.getDouble(key);
        if (Double.isNaN(v)) throw new CalibrationException(fileName + ": " + key + " no es numerico (" + h.getString(key) + ")");
        return v;
    }

    private static String normalizeUnit(String unit) {
        if (unit == null) return "";
        String u = unit.trim();
        if (u.startsWith("[") && u.endsWith("]") && u.length() >= 2) u = u.substring(1, u.length() - 1).trim();
        return u.toLowerCase(Locale.ROOT);
    }
}
