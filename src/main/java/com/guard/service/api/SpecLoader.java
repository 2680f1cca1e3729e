package com.guard.service.api;

import com.guard.model.ApiSpecification;

import java.nio.file.Path;

public interface SpecLoader {

    /**
     * Loads and parses one API document from a local file.
     *
     * @param source The path of a YAML or JSON OpenAPI document.
     * @return The read-only spec model of that document.
     * @throws com.guard.exception.InvalidSpecException    if the document cannot be turned into a spec model.
     * @throws com.guard.exception.InvalidVersionException if {@code info.version} is not a semantic version.
     * @throws com.guard.exception.ApiGuardException       if the file cannot be read.
     */
    ApiSpecification load(Path source);
}
