package com.chicu.botjobs.watch;

/**
 * Результат опроса одной WATCH-задачи.
 */
public record WatchPollOutcome(String jobId, String reply, boolean changed, String error) {

    public static WatchPollOutcome of(String jobId, String reply, boolean changed) {
        return new WatchPollOutcome(jobId, reply, changed, null);
    }

    public static WatchPollOutcome failed(String jobId, String error) {
        return new WatchPollOutcome(jobId, null, false, error == null ? "error" : error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
