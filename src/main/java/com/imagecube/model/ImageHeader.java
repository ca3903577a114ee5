package com.imagecube.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Header ordenado de una imagen: clave -> (valor, comentario).
 * Las claves se guardan en mayusculas, como en FITS.
 */
public class ImageHeader {

    private final LinkedHashMap<String, HeaderEntry> entries = new LinkedHashMap<>();

    public boolean contains(String key) {
        return entries.containsKey(normalize(key));
    }

    public Object get(String key) {
        HeaderEntry e = entries.get(normalize(key));
        return e == null ? null : e.value();
    }

    public String getString(String key) {
        Object v = get(key);
        return v == null ? null : v.toString().trim();
    }

    public String getComment(String key) {
        HeaderEntry e = entries.get(normalize(key));
        return e == null ? null : e.comment();
    }

    public double getDouble(String key, double defaultValue) {
        Object v = get(key);
        if (v instanceof Number) return ((Number) v).doubleValue();
        if (v instanceof String) {
            try {
                return Double.parseDouble(((String) v).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /** Devuelve NaN si la clave falta o no es numerica. */
    public double getDouble(String key) {
        return getDouble(key, Double.NaN);
    }

    public boolean hasNumber(String key) {
        return !Double.isNaN(getDouble(key));
    }

    public void set(String key, Object value, String comment) {
        entries.put(normalize(key), new HeaderEntry(value, comment));
    }

    /** Conserva el comentario existente. */
    public void set(String key, Object value) {
        set(key, value, getComment(key));
    }

    public void remove(String key) {
        entries.remove(normalize(key));
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Map<String, HeaderEntry> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }

    public ImageHeader copy() {
        ImageHeader h = new ImageHeader();
        h.entries.putAll(entries);
        return h;
    }

    private static String normalize(String key) {
        return key.trim().toUpperCase(Locale.ROOT);
    }
}
