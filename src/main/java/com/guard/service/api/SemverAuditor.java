package com.guard.service.api;

import com.guard.model.ApiChange;
import com.guard.model.BumpLevel;
import com.guard.model.SpecPair;
import com.guard.model.Violation;

import java.util.List;
import java.util.Optional;

public interface SemverAuditor {

    /**
     * Derives the smallest version bump that the detected changes call for.
     *
     * @param violations The rule violations found between the two specifications.
     * @param changes    All raw changes, used for the additive signal.
     * @return MAJOR, MINOR or PATCH.
     */
    BumpLevel requiredBump(List<Violation> violations, List<ApiChange> changes);

    /**
     * Compares the required bump with the actual version delta of the pair.
     *
     * @return A SEMVER_MISMATCH violation if the candidate was bumped too little, otherwise empty.
     */
    Optional<Violation> audit(List<Violation> violations, List<ApiChange> changes, SpecPair pair);
}
