package com.guard.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * The in-memory model of one version of an HTTP API, as loaded from a single document.
 * <p>
 * Operations are kept in a sorted map so that every walk over a specification visits
 * endpoints in the same order, whatever order the document declared them in.
 *
 * @param source          The file path exactly as it was supplied to the loader.
 * @param version         The declared {@code info.version} string, untouched.
 * @param semanticVersion The parsed form of {@code version}.
 * @param operations      All operations keyed by path and method.
 */
public record ApiSpecification(String source,
                               String version,
                               SemanticVersion semanticVersion,
                               Map<EndpointKey, ApiOperation> operations) {

    public ApiSpecification {
        operations = Collections.unmodifiableMap(new TreeMap<>(operations));
    }

    public ApiOperation operation(EndpointKey key) {
        return operations.get(key);
    }

    public boolean hasOperation(EndpointKey key) {
        return operations.containsKey(key);
    }
}
