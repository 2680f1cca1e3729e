package com.guard.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guard.exception.InvalidSpecException;
import com.guard.model.Rule;
import com.guard.model.Severity;
import com.guard.model.Violation;
import com.guard.service.api.CompatibilityChecker;
import com.guard.config.GuardProperties;
import com.guard.service.impl.ViolationReporterImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CheckRunnerTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private CompatibilityChecker checker;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private CheckRunner runner;

    @BeforeEach
    void setUp() {
        checker = mock(CompatibilityChecker.class);
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        runner = new CheckRunner(checker, new ViolationReporterImpl(new GuardProperties()),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void execute_withTooFewArguments_shouldPrintUsage() {
        int exitCode = runner.execute(List.of("only-one.yaml"), false);

        assertThat(exitCode).isEqualTo(CheckRunner.EXIT_USAGE);
        assertThat(stderr()).contains(CheckRunner.USAGE);
        assertThat(stdout()).isEmpty();
        verifyNoInteractions(checker);
    }

    @Test
    void execute_withTooManyArguments_shouldPrintUsage() {
        int exitCode = runner.execute(List.of("a.yaml", "b.yaml", "logs.json", "extra"), false);

        assertThat(exitCode).isEqualTo(CheckRunner.EXIT_USAGE);
        verifyNoInteractions(checker);
    }

    @Test
    void execute_shouldPrintReportAndExitZeroEvenWithViolations() throws Exception {
        Violation violation = Violation.builder()
                .rule(Rule.ENDPOINT_REMOVED)
                .path("/orders")
                .method("GET")
                .message("endpoint removed: GET /orders")
                .severity(Severity.HIGH)
                .build();
        when(checker.check(any(), any(), any())).thenReturn(List.of(violation));

        int exitCode = runner.execute(List.of("a.yaml", "b.yaml", "logs.json"), false);

        assertThat(exitCode).isEqualTo(CheckRunner.EXIT_OK);
        verify(checker).check(Paths.get("a.yaml"), Paths.get("b.yaml"), Paths.get("logs.json"));
        JsonNode report = objectMapper.readTree(stdout());
        assertThat(report.isArray()).isTrue();
        assertThat(report.get(0).get("rule").asText()).isEqualTo("ENDPOINT_REMOVED");
        assertThat(report.get(0).get("severity").asText()).isEqualTo("HIGH");
        assertThat(stderr()).isEmpty();
    }

    @Test
    void execute_withoutUsageLog_shouldPassNoLogAndPrintEmptyArray() {
        when(checker.check(any(), any(), isNull())).thenReturn(List.of());

        int exitCode = runner.execute(List.of("a.yaml", "b.yaml"), true);

        assertThat(exitCode).isEqualTo(CheckRunner.EXIT_OK);
        verify(checker).check(eq(Paths.get("a.yaml")), eq(Paths.get("b.yaml")), isNull());
        assertThat(stdout().trim()).isEqualTo("[]");
    }

    @Test
    void execute_whenCheckFails_shouldReportOnStderrOnly() {
        when(checker.check(any(), any(), any()))
                .thenThrow(new InvalidSpecException("API document b.yaml does not declare info.version"));

        int exitCode = runner.execute(List.of("a.yaml", "b.yaml"), false);

        assertThat(exitCode).isEqualTo(CheckRunner.EXIT_FAILURE);
        assertThat(stdout()).isEmpty();
        assertThat(stderr()).startsWith("error: API document b.yaml does not declare info.version");
    }

    @Test
    void run_shouldSeparateOptionsFromPositionalArguments() {
        when(checker.check(any(), any(), any())).thenReturn(List.of());

        runner.run(new DefaultApplicationArguments("a.yaml", "--verbose", "b.yaml"));

        assertThat(runner.getExitCode()).isEqualTo(CheckRunner.EXIT_OK);
        verify(checker).check(eq(Path.of("a.yaml")), eq(Path.of("b.yaml")), isNull());
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
