package com.guard.service.impl;

import com.guard.model.ApiChange;
import com.guard.model.ApiSpecification;
import com.guard.model.SpecPair;
import com.guard.model.UsageIndex;
import com.guard.model.Violation;
import com.guard.service.api.BaselineResolver;
import com.guard.service.api.CompatibilityChecker;
import com.guard.service.api.DiffEngine;
import com.guard.service.api.RuleClassifier;
import com.guard.service.api.SemverAuditor;
import com.guard.service.api.SpecLoader;
import com.guard.service.api.UsageLogParser;
import com.guard.service.api.ViolationReporter;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Wires the pipeline stages together. Every input is fully loaded before analysis starts,
 * so any failure surfaces before a single violation is produced.
 */
@Service
@Slf4j
public class CompatibilityCheckerImpl implements CompatibilityChecker {

    private final SpecLoader specLoader;
    private final UsageLogParser usageLogParser;
    private final BaselineResolver baselineResolver;
    private final DiffEngine diffEngine;
    private final RuleClassifier ruleClassifier;
    private final SemverAuditor semverAuditor;
    private final ViolationReporter reporter;

    public CompatibilityCheckerImpl(SpecLoader specLoader, UsageLogParser usageLogParser,
                                    BaselineResolver baselineResolver, DiffEngine diffEngine,
                                    RuleClassifier ruleClassifier, SemverAuditor semverAuditor,
                                    ViolationReporter reporter) {
        this.specLoader = specLoader;
        this.usageLogParser = usageLogParser;
        this.baselineResolver = baselineResolver;
        this.diffEngine = diffEngine;
        this.ruleClassifier = ruleClassifier;
        this.semverAuditor = semverAuditor;
        this.reporter = reporter;
    }

    @Override
    public List<Violation> check(Path firstSpec, Path secondSpec, Path usageLog) {
        ApiSpecification first = specLoader.load(firstSpec);
        ApiSpecification second = specLoader.load(secondSpec);
        UsageIndex usage = usageLog == null ? UsageIndex.empty() : usageLogParser.parse(usageLog);

        SpecPair pair = baselineResolver.resolve(first, second);
        List<ApiChange> changes = diffEngine.diff(pair);
        List<Violation> ruleViolations = ruleClassifier.classify(changes, pair, usage);
        List<Violation> versionViolations = semverAuditor.audit(ruleViolations, changes, pair)
                .map(List::of)
                .orElse(List.of());

        List<Violation> report = reporter.collect(List.of(ruleViolations, versionViolations));
        log.info("Compatibility check finished with {} violation(s)", report.size());
        return report;
    }
}
