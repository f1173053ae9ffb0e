package io.scrapejobs.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a success/failure callback command gets to know about the run, exposed as environment variables.
 */
public record CallbackContext(
        String jobId,
        String configName,
        RunOutcome outcome,
        int attempts,
        String errorSummary
) {
    public Map<String, String> toEnvironment() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("SCRAPEJOBS_JOB_ID", jobId);
        env.put("SCRAPEJOBS_CONFIG", configName == null ? "" : configName);
        env.put("SCRAPEJOBS_OUTCOME", outcome.value());
        env.put("SCRAPEJOBS_ATTEMPTS", Integer.toString(attempts));
        if (outcome == RunOutcome.FAILURE && errorSummary != null) {
            env.put("SCRAPEJOBS_ERROR", errorSummary);
        }
        return env;
    }
}
