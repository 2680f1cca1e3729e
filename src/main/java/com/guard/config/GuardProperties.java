package com.guard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for a compatibility check, bound from the {@code guard.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "guard")
public class GuardProperties {

    /**
     * Raise the severity of a violation by one level when the usage log shows the affected
     * endpoint was called.
     */
    private boolean usageEscalation = true;

    private Output output = new Output();

    @Data
    public static class Output {

        /**
         * Indent the JSON report instead of printing it on a single line.
         */
        private boolean pretty = false;
    }
}
