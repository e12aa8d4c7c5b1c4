package com.devicesim.core.model;

import java.io.Serializable;

/**
 * Address of an attribute inside a device: {@code part.attribute} for part attributes,
 * a bare {@code attribute} for global ones.
 *
 * @param part      owning part, or {@code null} for a global attribute
 * @param attribute attribute name
 */
public record AttributePath(
    String part,
    String attribute
) implements Serializable, Comparable<AttributePath> {

    public AttributePath {
        if (attribute == null || attribute.isBlank()) {
            throw new IllegalArgumentException("Attribute name must not be blank");
        }
    }

    public static AttributePath parse(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Attribute path must not be blank");
        }
        int dot = path.indexOf('.');
        if (dot < 0) {
            return new AttributePath(null, path.trim());
        }
        if (dot == 0 || dot == path.length() - 1 || path.indexOf('.', dot + 1) >= 0) {
            throw new IllegalArgumentException("Malformed attribute path: " + path);
        }
        return new AttributePath(path.substring(0, dot).trim(), path.substring(dot + 1).trim());
    }

    public boolean isGlobal() {
        return part == null;
    }

    @Override
    public int compareTo(AttributePath other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public String toString() {
        return part == null ? attribute : part + "." + attribute;
    }
}
