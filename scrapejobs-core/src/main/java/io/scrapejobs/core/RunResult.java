package io.scrapejobs.core;

public record RunResult(
        boolean success,
        String errorDetail
) {
    public static RunResult succeeded() {
        return new RunResult(true, null);
    }

    public static RunResult failed(String errorDetail) {
        return new RunResult(false, errorDetail);
    }
}
