package com.guard.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single compatibility violation as it appears in the report.
 * <p>
 * Built in one go by the stage that detects it and never modified afterwards. The evidence map
 * is serialized as {@code object} and always starts with the baseline/candidate identifiers.
 */
@Value
@Builder
@JsonPropertyOrder({"rule", "path", "method", "message", "severity", "object"})
public class Violation {

    public static final String BASELINE_FILE = "baseline_file";
    public static final String CANDIDATE_FILE = "candidate_file";
    public static final String BASELINE_VERSION = "baseline_version";
    public static final String CANDIDATE_VERSION = "candidate_version";

    @NonNull
    Rule rule;

    /**
     * The affected path, empty for document-level rules.
     */
    @NonNull
    @Builder.Default
    String path = "";

    /**
     * The affected HTTP method, empty for document-level rules.
     */
    @NonNull
    @Builder.Default
    String method = "";

    @NonNull
    String message;

    @NonNull
    Severity severity;

    @JsonProperty("object")
    @NonNull
    @Builder.Default
    Map<String, Object> evidence = Collections.emptyMap();

    /**
     * Starts an evidence map holding the four identifiers every violation carries.
     * Callers append their rule-specific fields to the returned map.
     */
    public static Map<String, Object> evidenceFor(SpecPair pair) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put(BASELINE_FILE, pair.baseline().source());
        evidence.put(CANDIDATE_FILE, pair.candidate().source());
        evidence.put(BASELINE_VERSION, pair.baseline().version());
        evidence.put(CANDIDATE_VERSION, pair.candidate().version());
        return evidence;
    }
}
