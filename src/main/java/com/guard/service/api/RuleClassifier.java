package com.guard.service.api;

import com.guard.model.ApiChange;
import com.guard.model.SpecPair;
import com.guard.model.UsageIndex;
import com.guard.model.Violation;

import java.util.List;

public interface RuleClassifier {

    /**
     * Maps raw changes to compatibility rules. Each change yields zero or one violation.
     *
     * @param changes The changes reported by the {@link DiffEngine}.
     * @param pair    The compared specifications, used for the violation evidence.
     * @param usage   Observed traffic, used to escalate severities.
     * @return One violation per change that triggered a rule.
     */
    List<Violation> classify(List<ApiChange> changes, SpecPair pair, UsageIndex usage);
}
