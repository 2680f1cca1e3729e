package com.guard;

import com.guard.cli.CheckRunner;
import com.guard.config.GuardProperties;
import com.guard.model.Rule;
import com.guard.model.Violation;
import com.guard.service.api.CompatibilityChecker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static com.guard.TestFixtures.resource;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApiChangeGuardApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private CompatibilityChecker checker;

    @Autowired
    private GuardProperties properties;

    @Test
    void contextLoads_withoutStartingTheRunner() {
        assertThat(context.getBeansOfType(CheckRunner.class)).isEmpty();
        assertThat(properties.isUsageEscalation()).isTrue();
        assertThat(properties.getOutput().isPretty()).isFalse();
    }

    @Test
    void checker_shouldBeFullyWired() {
        List<Violation> report = checker.check(
                resource("specs/endpoint-removed/baseline.yaml"),
                resource("specs/endpoint-removed/candidate.yaml"),
                resource("logs/orders-usage.json"));

        assertThat(report).extracting(Violation::getRule)
                .containsExactly(Rule.ENDPOINT_REMOVED, Rule.SEMVER_MISMATCH);
    }
}
