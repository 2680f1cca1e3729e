package com.guard.model;

/**
 * Kinds of structural difference the diff engine reports between two specifications.
 * Each kind knows whether it extends the API surface without invalidating existing clients.
 */
public enum ChangeType {
    ENDPOINT_ADDED(true),
    ENDPOINT_REMOVED(false),
    PARAMETER_ADDED(false),
    PARAMETER_REMOVED(false),
    PARAMETER_BECAME_REQUIRED(false),
    PARAMETER_BECAME_OPTIONAL(false),
    PARAMETER_TYPE_CHANGED(false),
    RESPONSE_ADDED(true),
    RESPONSE_REMOVED(false);

    private final boolean additive;

    ChangeType(boolean additive) {
        this.additive = additive;
    }

    /**
     * Whether this kind of change is always additive. {@link #PARAMETER_ADDED} is not listed as
     * additive because it depends on the new parameter: see {@link ApiChange#isAdditive()}.
     */
    public boolean isAdditive() {
        return additive;
    }
}
