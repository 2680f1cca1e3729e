package com.guard.model;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * Identifies one endpoint of an API: a URL path template plus an upper-case HTTP method.
 * Ordering is by path, then method, which is the order every walk over a spec uses.
 *
 * @param path   The URL path template, e.g. {@code /orders/{id}}.
 * @param method The HTTP verb in upper case, e.g. {@code GET}.
 */
public record EndpointKey(String path, String method) implements Comparable<EndpointKey> {

    private static final Comparator<EndpointKey> ORDER = Comparator
            .comparing(EndpointKey::path)
            .thenComparing(EndpointKey::method);

    public EndpointKey {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(method, "method");
        method = method.toUpperCase(Locale.ROOT);
    }

    /**
     * Shorthand factory, normalizing the method to upper case.
     */
    public static EndpointKey of(String path, String method) {
        return new EndpointKey(path, method);
    }

    @Override
    public int compareTo(EndpointKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
