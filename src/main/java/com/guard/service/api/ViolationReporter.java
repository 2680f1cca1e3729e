package com.guard.service.api;

import com.guard.model.Violation;

import java.util.Collection;
import java.util.List;

public interface ViolationReporter {

    /**
     * Merges violations into a single list in report order. The inputs are left untouched.
     *
     * @param sources The violation collections produced by the pipeline stages.
     * @return A new, sorted, unmodifiable list.
     */
    List<Violation> collect(Collection<? extends Collection<Violation>> sources);

    /**
     * Serializes violations to the report's JSON array format.
     *
     * @param violations The violations in report order.
     * @return A JSON array, {@code []} when there is nothing to report.
     */
    String toJson(List<Violation> violations);
}
