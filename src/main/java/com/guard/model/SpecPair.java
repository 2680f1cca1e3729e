package com.guard.model;

import java.util.Objects;

/**
 * The two documents of a comparison, tagged with their role. Built once by the baseline
 * resolver before any diffing starts; nothing downstream looks at argument order again.
 *
 * @param baseline  The older API version.
 * @param candidate The newer API version.
 */
public record SpecPair(ApiSpecification baseline, ApiSpecification candidate) {

    public SpecPair {
        Objects.requireNonNull(baseline, "baseline");
        Objects.requireNonNull(candidate, "candidate");
    }
}
