package com.guard.service.api;

import com.guard.model.Violation;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs a full compatibility check: load, resolve baseline and candidate, diff, classify,
 * audit the version bump and collect the report.
 */
public interface CompatibilityChecker {

    /**
     * @param firstSpec  One API document.
     * @param secondSpec The other API document, in either order relative to {@code firstSpec}.
     * @param usageLog   An optional usage log, or {@code null} when none was supplied.
     * @return The sorted violations. Empty when the versions are compatible.
     */
    List<Violation> check(Path firstSpec, Path secondSpec, Path usageLog);
}
