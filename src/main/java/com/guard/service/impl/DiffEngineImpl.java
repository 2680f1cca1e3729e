package com.guard.service.impl;

import com.guard.model.ApiChange;
import com.guard.model.ApiOperation;
import com.guard.model.ApiParameter;
import com.guard.model.ApiSpecification;
import com.guard.model.ChangeType;
import com.guard.model.EndpointKey;
import com.guard.model.SpecPair;
import com.guard.service.api.DiffEngine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Walks the union of both specifications' endpoints in sorted order and records every
 * structural difference, without judging whether it is breaking.
 */
@Service
@Slf4j
public class DiffEngineImpl implements DiffEngine {

    @Override
    public List<ApiChange> diff(SpecPair pair) {
        ApiSpecification baseline = pair.baseline();
        ApiSpecification candidate = pair.candidate();

        SortedSet<EndpointKey> endpoints = new TreeSet<>(baseline.operations().keySet());
        endpoints.addAll(candidate.operations().keySet());

        List<ApiChange> changes = new ArrayList<>();
        for (EndpointKey key : endpoints) {
            ApiOperation before = baseline.operation(key);
            ApiOperation after = candidate.operation(key);
            if (after == null) {
                changes.add(ApiChange.endpoint(ChangeType.ENDPOINT_REMOVED, key));
            } else if (before == null) {
                changes.add(ApiChange.endpoint(ChangeType.ENDPOINT_ADDED, key));
            } else {
                diffParameters(key, before, after, changes);
                diffResponses(key, before, after, changes);
            }
        }
        log.debug("Found {} changes between {} and {}", changes.size(), baseline.source(), candidate.source());
        return changes;
    }

    private void diffParameters(EndpointKey key, ApiOperation before, ApiOperation after, List<ApiChange> changes) {
        SortedSet<String> names = new TreeSet<>(before.parameters().keySet());
        names.addAll(after.parameters().keySet());

        for (String name : names) {
            ApiParameter old = before.parameter(name);
            ApiParameter current = after.parameter(name);
            if (current == null) {
                changes.add(ApiChange.parameter(ChangeType.PARAMETER_REMOVED, key, name, old, null));
                continue;
            }
            if (old == null) {
                changes.add(ApiChange.parameter(ChangeType.PARAMETER_ADDED, key, name, null, current));
                continue;
            }
            if (!old.required() && current.required()) {
                changes.add(ApiChange.parameter(ChangeType.PARAMETER_BECAME_REQUIRED, key, name, old, current));
            } else if (old.required() && !current.required()) {
                changes.add(ApiChange.parameter(ChangeType.PARAMETER_BECAME_OPTIONAL, key, name, old, current));
            }
            // A type is only compared when both documents declare one.
            if (old.type() != null && current.type() != null && !Objects.equals(old.type(), current.type())) {
                changes.add(ApiChange.parameter(ChangeType.PARAMETER_TYPE_CHANGED, key, name, old, current));
            }
        }
    }

    private void diffResponses(EndpointKey key, ApiOperation before, ApiOperation after, List<ApiChange> changes) {
        SortedSet<String> codes = new TreeSet<>(before.responses());
        codes.addAll(after.responses());

        for (String code : codes) {
            boolean inBaseline = before.hasResponse(code);
            boolean inCandidate = after.hasResponse(code);
            if (inBaseline && !inCandidate) {
                changes.add(ApiChange.response(ChangeType.RESPONSE_REMOVED, key, code));
            } else if (!inBaseline && inCandidate) {
                changes.add(ApiChange.response(ChangeType.RESPONSE_ADDED, key, code));
            }
        }
    }
}
