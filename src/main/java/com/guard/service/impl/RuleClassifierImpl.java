package com.guard.service.impl;

import com.guard.model.ApiChange;
import com.guard.model.EndpointKey;
import com.guard.model.Rule;
import com.guard.model.SpecPair;
import com.guard.model.UsageIndex;
import com.guard.model.Violation;
import com.guard.service.api.RuleClassifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Maps raw changes to the four structural compatibility rules.
 * <p>
 * Only changes that can break an existing client become violations: a removed endpoint, a
 * parameter that must now be sent, a parameter whose type changed, and a dropped 200 response.
 * Everything else (additions, relaxations, other removed responses) produces nothing here.
 */
@Service
@Slf4j
public class RuleClassifierImpl implements RuleClassifier {

    static final String SUCCESS_STATUS = "200";

    private final UsageEscalationPolicy escalationPolicy;

    public RuleClassifierImpl(UsageEscalationPolicy escalationPolicy) {
        this.escalationPolicy = escalationPolicy;
    }

    @Override
    public List<Violation> classify(List<ApiChange> changes, SpecPair pair, UsageIndex usage) {
        List<Violation> violations = new ArrayList<>();
        for (ApiChange change : changes) {
            Violation violation = classify(change, pair, usage);
            if (violation != null) {
                log.debug("{} on {}: {}", violation.getRule(), change.endpoint(), violation.getMessage());
                violations.add(violation);
            }
        }
        log.info("{} of {} changes are rule violations", violations.size(), changes.size());
        return violations;
    }

    private Violation classify(ApiChange change, SpecPair pair, UsageIndex usage) {
        Map<String, Object> evidence = Violation.evidenceFor(pair);
        EndpointKey endpoint = change.endpoint();

        switch (change.type()) {
            case ENDPOINT_REMOVED:
                evidence.put("usage_count", usage.countFor(endpoint.path(), endpoint.method()));
                return build(Rule.ENDPOINT_REMOVED, endpoint, "endpoint removed: " + endpoint, evidence, usage);
            case PARAMETER_ADDED:
                if (!change.after().required()) {
                    return null;
                }
                return requiredParameterAdded(change, "absent", evidence, usage);
            case PARAMETER_BECAME_REQUIRED:
                return requiredParameterAdded(change, "optional", evidence, usage);
            case PARAMETER_TYPE_CHANGED:
                String oldType = change.before().type().tag();
                String newType = change.after().type().tag();
                evidence.put("parameter", change.subject());
                evidence.put("location", String.valueOf(change.after().location()));
                evidence.put("old_type", oldType);
                evidence.put("new_type", newType);
                return build(Rule.PARAM_TYPE_CHANGED, endpoint,
                        "parameter type changed: " + change.subject() + " " + oldType + " -> " + newType,
                        evidence, usage);
            case RESPONSE_REMOVED:
                if (!SUCCESS_STATUS.equals(change.subject())) {
                    return null;
                }
                evidence.put("status_code", SUCCESS_STATUS);
                return build(Rule.RESPONSE_200_REMOVED, endpoint, "success response removed: " + SUCCESS_STATUS,
                        evidence, usage);
            default:
                return null;
        }
    }

    private Violation requiredParameterAdded(ApiChange change, String baselineState,
                                             Map<String, Object> evidence, UsageIndex usage) {
        evidence.put("parameter", change.subject());
        evidence.put("location", String.valueOf(change.after().location()));
        evidence.put("baseline_state", baselineState);
        return build(Rule.PARAM_REQUIRED_ADDED, change.endpoint(),
                "required parameter added: " + change.subject(), evidence, usage);
    }

    private Violation build(Rule rule, EndpointKey endpoint, String message, Map<String, Object> evidence,
                            UsageIndex usage) {
        boolean used = usage.wasUsed(endpoint.path(), endpoint.method());
        return Violation.builder()
                .rule(rule)
                .path(endpoint.path())
                .method(endpoint.method())
                .message(message)
                .severity(escalationPolicy.apply(rule.getBaseSeverity(), used))
                .evidence(Collections.unmodifiableMap(evidence))
                .build();
    }
}
