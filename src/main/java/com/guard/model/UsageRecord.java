package com.guard.model;

/**
 * Aggregated traffic for one endpoint, folded from any number of log entries.
 *
 * @param path   The requested path.
 * @param method The upper-case HTTP method.
 * @param count  How many calls were observed, never negative.
 */
public record UsageRecord(String path, String method, long count) {

    public EndpointKey key() {
        return EndpointKey.of(path, method);
    }
}
