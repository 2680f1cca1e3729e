package com.guard.model;

/**
 * The closed set of compatibility rules a check can report, with the severity each starts at.
 */
public enum Rule {
    /**
     * An endpoint of the baseline no longer exists in the candidate.
     */
    ENDPOINT_REMOVED(Severity.MEDIUM, true),
    /**
     * A parameter that clients could omit before must now be sent.
     */
    PARAM_REQUIRED_ADDED(Severity.HIGH, true),
    /**
     * A parameter kept its name but changed its declared type.
     */
    PARAM_TYPE_CHANGED(Severity.HIGH, true),
    /**
     * The 200 response of a surviving endpoint was dropped.
     */
    RESPONSE_200_REMOVED(Severity.HIGH, true),
    /**
     * The declared version was not bumped enough for the changes found.
     */
    SEMVER_MISMATCH(Severity.HIGH, false);

    private final Severity baseSeverity;
    private final boolean breaking;

    Rule(Severity baseSeverity, boolean breaking) {
        this.baseSeverity = baseSeverity;
        this.breaking = breaking;
    }

    public Severity getBaseSeverity() {
        return baseSeverity;
    }

    /**
     * Whether a violation of this rule demands a major version bump.
     */
    public boolean isBreaking() {
        return breaking;
    }
}
