package io.scrapejobs.core;

/**
 * Arguments handed to the external run operation for one attempt.
 *
 * @param outputPath the job's output path override with {@code {date}} already resolved; may be null
 */
public record RunRequest(
        String jobId,
        String configName,
        String outputFormatOverride,
        String outputPath,
        int attemptNumber
) {
}
