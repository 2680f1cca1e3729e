package com.guard.model;

/**
 * A single parameter of an {@link ApiOperation}.
 *
 * @param name     The parameter name, unique within its operation.
 * @param location Where the parameter is sent: "path", "query", "header" or "cookie".
 * @param required Whether a client must supply the parameter.
 * @param type     The declared schema type, or {@code null} if the document declares none.
 */
public record ApiParameter(String name, String location, boolean required, ParameterType type) {
}
