package com.imagecube.model;

/** Valor de una clave del header con su comentario (puede ser null). */
public record HeaderEntry(Object value, String comment) {
}
