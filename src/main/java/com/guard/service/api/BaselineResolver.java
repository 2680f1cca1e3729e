package com.guard.service.api;

import com.guard.model.ApiSpecification;
import com.guard.model.SpecPair;

public interface BaselineResolver {

    /**
     * Decides which of two specifications is the baseline and which is the candidate.
     * The result must not depend on the order of the arguments.
     *
     * @param first  One of the two specifications.
     * @param second The other one.
     * @return The tagged pair.
     */
    SpecPair resolve(ApiSpecification first, ApiSpecification second);
}
