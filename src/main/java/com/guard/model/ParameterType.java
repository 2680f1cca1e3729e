package com.guard.model;

import com.guard.exception.InvalidSpecException;

import java.util.Locale;

/**
 * Semantic type tag of a parameter, taken from its schema.
 */
public enum ParameterType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT;

    /**
     * Resolves a schema type tag such as {@code "integer"}.
     *
     * @param tag The tag as written in the document, may be {@code null}.
     * @return The matching type, or {@code null} when the document declares no type.
     * @throws InvalidSpecException if the tag is not one of the known types.
     */
    public static ParameterType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return null;
        }
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidSpecException("Unknown parameter type '" + tag + "'", e);
        }
    }

    /**
     * The tag as it appears in API documents, e.g. {@code "integer"}.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
