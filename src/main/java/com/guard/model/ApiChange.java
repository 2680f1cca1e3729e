package com.guard.model;

/**
 * One raw structural difference between a baseline and a candidate specification.
 * <p>
 * The meaning of {@code subject}, {@code before} and {@code after} depends on the type:
 * <ul>
 *   <li>endpoint changes: subject is empty, before/after are {@code null};</li>
 *   <li>parameter changes: subject is the parameter name, before/after are the baseline and
 *       candidate parameters (either may be {@code null} for additions and removals);</li>
 *   <li>response changes: subject is the status code.</li>
 * </ul>
 *
 * @param type     What kind of change this is.
 * @param endpoint The endpoint the change belongs to.
 * @param subject  The parameter name or status code, empty for endpoint changes.
 * @param before   The baseline parameter, if any.
 * @param after    The candidate parameter, if any.
 */
public record ApiChange(ChangeType type, EndpointKey endpoint, String subject, ApiParameter before, ApiParameter after) {

    static final String SUCCESS_STATUS = "200";

    public static ApiChange endpoint(ChangeType type, EndpointKey endpoint) {
        return new ApiChange(type, endpoint, "", null, null);
    }

    public static ApiChange parameter(ChangeType type, EndpointKey endpoint, String name,
                                      ApiParameter before, ApiParameter after) {
        return new ApiChange(type, endpoint, name, before, after);
    }

    public static ApiChange response(ChangeType type, EndpointKey endpoint, String statusCode) {
        return new ApiChange(type, endpoint, statusCode, null, null);
    }

    /**
     * Whether this change extends the API without breaking existing clients: a new endpoint,
     * a new non-200 response code, or a new parameter that clients may leave out.
     */
    public boolean isAdditive() {
        if (type == ChangeType.PARAMETER_ADDED) {
            return after != null && !after.required();
        }
        if (type == ChangeType.RESPONSE_ADDED) {
            return !SUCCESS_STATUS.equals(subject);
        }
        return type.isAdditive();
    }
}
