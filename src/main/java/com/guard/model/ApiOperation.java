package com.guard.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * One endpoint of an API version: a path and method together with the parameters it accepts
 * and the response status codes it declares.
 * <p>
 * Instances are read-only; the collections handed in are copied and wrapped.
 *
 * @param path       The URL path template.
 * @param method     The upper-case HTTP method.
 * @param parameters Parameters keyed by name.
 * @param responses  Declared status codes as written in the document ("200", "404", "default").
 */
public record ApiOperation(String path, String method, Map<String, ApiParameter> parameters, Set<String> responses) {

    public ApiOperation {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        responses = Collections.unmodifiableSet(new TreeSet<>(responses));
    }

    public EndpointKey key() {
        return EndpointKey.of(path, method);
    }

    public ApiParameter parameter(String name) {
        return parameters.get(name);
    }

    public boolean hasResponse(String statusCode) {
        return responses.contains(statusCode);
    }
}
