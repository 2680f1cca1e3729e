package com.guard.service.impl;

import com.guard.exception.LogParseException;
import com.guard.model.UsageIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Paths;

import static com.guard.TestFixtures.resource;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UsageLogParserImplTest {

    private UsageLogParserImpl usageLogParser;

    @BeforeEach
    void setUp() {
        usageLogParser = new UsageLogParserImpl();
    }

    @Test
    void parse_shouldFoldRecordsIntoCountsPerEndpoint() {
        UsageIndex usage = usageLogParser.parse(resource("logs/orders-usage.json"));

        assertThat(usage.countFor("/orders", "GET")).isEqualTo(2);
        assertThat(usage.countFor("/orders/{id}", "GET")).isEqualTo(12);
        assertThat(usage.wasUsed("/orders", "GET")).isTrue();
        assertThat(usage.wasUsed("/health", "GET")).isFalse();
        assertThat(usage.wasUsed("/orders", "POST")).isFalse();
    }

    @Test
    void parse_shouldTreatBlankFileAsEmptyLog() {
        UsageIndex usage = usageLogParser.parse(resource("logs/blank.json"));

        assertThat(usage.isEmpty()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "logs/missing-method.json",
            "logs/not-an-array.json",
            "logs/negative-count.json",
            "logs/truncated.json",
            "logs/trailing-garbage.json"
    })
    void parse_shouldRejectMalformedLogs(String log) {
        assertThrows(LogParseException.class, () -> usageLogParser.parse(resource(log)));
    }

    @Test
    void parse_shouldRejectMissingFile() {
        assertThrows(LogParseException.class, () -> usageLogParser.parse(Paths.get("no/such/usage.json")));
    }
}
