package com.guard.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guard.exception.LogParseException;
import com.guard.model.UsageIndex;
import com.guard.model.UsageRecord;
import com.guard.service.api.UsageLogParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * An implementation of the {@link UsageLogParser} that reads a JSON array of request records.
 * <p>
 * Each element must be an object with a string {@code path} and a string {@code method}. An
 * element counts as one call, or as {@code count} calls when it carries a non-negative integer
 * {@code count} field. A blank file is an empty log.
 */
@Service
@Slf4j
public class UsageLogParserImpl implements UsageLogParser {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    @Override
    public UsageIndex parse(Path logFile) {
        String contents;
        try {
            contents = Files.readString(logFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LogParseException("Cannot read usage log " + logFile + ": " + e.getMessage(), e);
        }
        if (contents.isBlank()) {
            log.warn("Usage log {} is empty; no endpoint will be treated as used.", logFile);
            return UsageIndex.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(contents);
        } catch (JsonProcessingException e) {
            throw new LogParseException("Usage log " + logFile + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new LogParseException("Usage log " + logFile + " must contain a JSON array of request records");
        }

        List<UsageRecord> records = new ArrayList<>();
        int index = 0;
        for (JsonNode entry : root) {
            records.add(parseEntry(entry, index++, logFile));
        }
        UsageIndex usage = UsageIndex.of(records);
        log.info("Read {} usage records covering {} endpoints from {}", records.size(), usage.size(), logFile);
        return usage;
    }

    private UsageRecord parseEntry(JsonNode entry, int index, Path logFile) {
        if (!entry.isObject()) {
            throw new LogParseException("Usage log " + logFile + ": record " + index + " is not an object");
        }
        JsonNode path = entry.path("path");
        JsonNode method = entry.path("method");
        if (!path.isTextual() || path.asText().isBlank()) {
            throw new LogParseException("Usage log " + logFile + ": record " + index + " has no string 'path'");
        }
        if (!method.isTextual() || method.asText().isBlank()) {
            throw new LogParseException("Usage log " + logFile + ": record " + index + " has no string 'method'");
        }

        long count = 1;
        JsonNode countNode = entry.get("count");
        if (countNode != null && !countNode.isNull()) {
            if (!countNode.canConvertToExactIntegral() || !countNode.canConvertToLong() || countNode.asLong() < 0) {
                throw new LogParseException("Usage log " + logFile + ": record " + index
                        + " has an invalid 'count' (expected a non-negative integer)");
            }
            count = countNode.asLong();
        }
        return new UsageRecord(path.asText(), method.asText().trim().toUpperCase(Locale.ROOT), count);
    }
}
