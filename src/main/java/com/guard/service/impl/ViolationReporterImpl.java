package com.guard.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.guard.config.GuardProperties;
import com.guard.exception.ApiGuardException;
import com.guard.model.Violation;
import com.guard.service.api.ViolationReporter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Produces the final report: one list ordered by rule name, path and method, serialized as a
 * JSON array. The message breaks ties between violations of the same rule on the same endpoint,
 * so the output is byte-identical across runs.
 */
@Service
public class ViolationReporterImpl implements ViolationReporter {

    static final Comparator<Violation> REPORT_ORDER = Comparator
            .comparing((Violation v) -> v.getRule().name())
            .thenComparing(Violation::getPath)
            .thenComparing(Violation::getMethod)
            .thenComparing(Violation::getMessage);

    private final ObjectMapper objectMapper;

    @Autowired
    public ViolationReporterImpl(GuardProperties properties) {
        this(properties.getOutput().isPretty());
    }

    ViolationReporterImpl(boolean pretty) {
        this.objectMapper = new ObjectMapper();
        if (pretty) {
            objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    @Override
    public List<Violation> collect(Collection<? extends Collection<Violation>> sources) {
        List<Violation> merged = new ArrayList<>();
        sources.forEach(merged::addAll);
        merged.sort(REPORT_ORDER);
        return Collections.unmodifiableList(merged);
    }

    @Override
    public String toJson(List<Violation> violations) {
        try {
            return objectMapper.writeValueAsString(violations == null ? Collections.emptyList() : violations);
        } catch (JsonProcessingException e) {
            throw new ApiGuardException("Failed to serialize the violation report", e);
        }
    }
}
