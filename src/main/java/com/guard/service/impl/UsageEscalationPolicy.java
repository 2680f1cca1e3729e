package com.guard.service.impl;

import com.guard.config.GuardProperties;
import com.guard.model.Severity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns a rule's base severity into the reported one, given whether the affected endpoint
 * shows up in the usage log. Used endpoints are raised one level, capped at HIGH.
 */
@Component
public class UsageEscalationPolicy {

    private final boolean enabled;

    @Autowired
    public UsageEscalationPolicy(GuardProperties properties) {
        this(properties.isUsageEscalation());
    }

    UsageEscalationPolicy(boolean enabled) {
        this.enabled = enabled;
    }

    public Severity apply(Severity base, boolean wasUsed) {
        if (!enabled || !wasUsed) {
            return base;
        }
        return base.raised();
    }
}
