package com.guard.service.impl;

import com.guard.model.ApiChange;
import com.guard.model.BumpLevel;
import com.guard.model.Rule;
import com.guard.model.Severity;
import com.guard.model.SpecPair;
import com.guard.model.Violation;
import com.guard.service.api.SemverAuditor;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Checks that the candidate's declared version moved far enough past the baseline's.
 * <p>
 * Breaking violations require a major bump, additive changes a minor one, anything else a
 * patch. A required patch is also met by an unchanged version, and a candidate may always
 * bump more than required.
 */
@Service
@Slf4j
public class SemverAuditorImpl implements SemverAuditor {

    @Override
    public BumpLevel requiredBump(List<Violation> violations, List<ApiChange> changes) {
        if (violations.stream().anyMatch(v -> v.getRule().isBreaking())) {
            return BumpLevel.MAJOR;
        }
        if (changes.stream().anyMatch(ApiChange::isAdditive)) {
            return BumpLevel.MINOR;
        }
        return BumpLevel.PATCH;
    }

    @Override
    public Optional<Violation> audit(List<Violation> violations, List<ApiChange> changes, SpecPair pair) {
        BumpLevel required = requiredBump(violations, changes);
        BumpLevel actual = pair.baseline().semanticVersion().bumpTo(pair.candidate().semanticVersion());
        log.info("Version {} -> {}: required bump {}, actual bump {}",
                pair.baseline().version(), pair.candidate().version(), required.label(), actual.label());

        if (required == BumpLevel.PATCH || !actual.isSmallerThan(required)) {
            return Optional.empty();
        }

        String message = actual == BumpLevel.NONE
                ? "expected " + required.label()
                : "expected " + required.label() + " got " + actual.label();
        Map<String, Object> evidence = Violation.evidenceFor(pair);
        evidence.put("required_bump", required.label());
        evidence.put("actual_bump", actual.label());

        return Optional.of(Violation.builder()
                .rule(Rule.SEMVER_MISMATCH)
                .message(message)
                .severity(Severity.HIGH)
                .evidence(Collections.unmodifiableMap(evidence))
                .build());
    }
}
