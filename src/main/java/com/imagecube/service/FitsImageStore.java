package com.imagecube.service;

import com.imagecube.model.HeaderEntry;
import com.imagecube.model.ImageHeader;
import com.imagecube.model.RasterImage;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.BufferedFile;
import nom.tam.util.Cursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** {@link ImageStore} sobre ficheros FITS (nom-tam-fits). */
public class FitsImageStore implements ImageStore {

    private static final Logger logger = LoggerFactory.getLogger(FitsImageStore.class);

    // Claves que describen la estructura del HDU; las regenera el writer
    private static final Set<String> STRUCTURAL = Set.of(
            "SIMPLE", "BITPIX", "EXTEND", "XTENSION", "PCOUNT", "GCOUNT", "END",
            "BZERO", "BSCALE", "BLANK", "CHECKSUM", "DATASUM");

    public FitsImageStore() {
        FitsFactory.setLongStringsEnabled(true);
    }

    @Override
    public List<Path> listInputs(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).matches(".*\\.fit.*"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    @Override
    public RasterImage read(Path file) throws IOException {
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?> primary = fits.getHDU(0);
            if (primary == null) throw new IOException("FITS sin HDU primario: " + file);
            Header ph = primary.getHeader();

            // Cubos de datos: la imagen cientifica esta en la primera extension
            BasicHDU<?> science = primary;
            if (ph.containsKey("EXTEND") && ph.containsKey("DSETS___")) {
                BasicHDU<?> ext = fits.getHDU(1);
                if (ext != null) science = ext;
            }
            Header sh = science.getHeader();
            double bzero = sh.getDoubleValue("BZERO", 0);
            double bscale = sh.getDoubleValue("BSCALE", 1);

            double[][] pixels = toDoublePlane(science.getKernel(), bzero, bscale);
            if (pixels.length == 0) throw new IOException("Sin datos de imagen 2-D: " + file);

            logger.debug("Leido {} ({}x{})", file.getFileName(), pixels[0].length, pixels.length);
            return new RasterImage(pixels, toImageHeader(ph));
        } catch (FitsException e) {
            throw new IOException("No se pudo leer " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void write(RasterImage image, Path file) throws IOException {
        writeData(image.pixels(), image.header(), file);
    }

    @Override
    public void writeCube(double[][][] cube, ImageHeader header, Path file) throws IOException {
        writeData(cube, header, file);
    }

    private void writeData(Object data, ImageHeader header, Path file) throws IOException {
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        Files.deleteIfExists(file);
        try (Fits out = new Fits(); BufferedFile bf = new BufferedFile(file.toFile(), "rw")) {
            BasicHDU<?> hdu = Fits.makeHDU(data);
            copyInto(header, hdu.getHeader());
            out.addHDU(hdu);
            out.write(bf);
            logger.info("Creado {}", file);
        } catch (FitsException e) {
            throw new IOException("No se pudo escribir " + file + ": " + e.getMessage(), e);
        }
    }

    static ImageHeader toImageHeader(Header h) {
        ImageHeader out = new ImageHeader();
        Cursor<String, HeaderCard> it = h.iterator();
        while (it.hasNext()) {
            HeaderCard card = it.next();
            String key = card.getKey();
            if (key == null || !card.isKeyValuePair() || isStructural(key)) continue;
            Object value = card.isStringValue() ? card.getValue() : parseValue(card.getValue());
            out.set(key, value, card.getComment());
        }
        return out;
    }

    private static void copyInto(ImageHeader source, Header target) throws FitsException {
        for (Map.Entry<String, HeaderEntry> e : source.entries().entrySet()) {
            String key = e.getKey();
            Object v = e.getValue().value();
            String comment = e.getValue().comment();
            if (isStructural(key) || key.length() > 8 || v == null) {
                logger.debug("Clave {} omitida al escribir", key);
                continue;
            }
            if (v instanceof Boolean) {
                target.addValue(key, (Boolean) v, comment);
            } else if (v instanceof Integer || v instanceof Long) {
                target.addValue(key, ((Number) v).longValue(), comment);
            } else if (v instanceof Number) {
                double d = ((Number) v).doubleValue();
                if (!Double.isFinite(d)) {
                    logger.debug("Clave {} con valor no finito omitida", key);
                    continue;
                }
                target.addValue(key, d, comment);
            } else {
                target.addValue(key, v.toString(), comment);
            }
        }
    }

    private static boolean isStructural(String key) {
        return STRUCTURAL.contains(key) || key.startsWith("NAXIS");
    }

    private static Object parseValue(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.equals("T")) return Boolean.TRUE;
        if (s.equals("F")) return Boolean.FALSE;
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException ignored) {
            // no es entero
        }
        try {
            return Double.parseDouble(s.replace('D', 'E').replace('d', 'e'));
        } catch (NumberFormatException ignored) {
            return s;
        }
    }

    /** Cualquier array numerico -> double[y][x]. Si tiene mas de 2 ejes se usa el primer plano. */
    static double[][] toDoublePlane(Object k, double bzero, double bscale) {
        if (k == null) return new double[0][0];
        while (k.getClass().isArray() && k.getClass().getName().lastIndexOf('[') + 1 > 2) {
            Object[] outer = (Object[]) k;
            if (outer.length == 0) return new double[0][0];
            k = outer[0];
        }
        if (k instanceof double[][]) {
            double[][] s = (double[][]) k;
            double[][] d = new double[s.length][];
            for (int i = 0; i < s.length; i++) d[i] = s[i].clone();
            return d;
        }
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            double[][] d = new double[f.length][f.length == 0 ? 0 : f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[i].length; j++) d[i][j] = f[i][j];
            return d;
        }
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            double[][] d = new double[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) d[i][j] = bzero + bscale * s[i][j];
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            double[][] d = new double[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) d[i][j] = bzero + bscale * s[i][j];
            return d;
        }
        if (k instanceof long[][]) {
            long[][] s = (long[][]) k;
            double[][] d = new double[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) d[i][j] = bzero + bscale * s[i][j];
            return d;
        }
        if (k instanceof byte[][]) {
            byte[][] s = (byte[][]) k;
            double[][] d = new double[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) d[i][j] = bzero + bscale * (s[i][j] & 0xFF);
            return d;
        }
        return new double[0][0];
    }
}
