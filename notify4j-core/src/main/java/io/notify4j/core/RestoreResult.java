package io.notify4j.core;

/**
 * Outcome of rebuilding the live registry at process start.
 *
 * restored : enabled schedules that received a live timer
 * skipped  : disabled schedules (and events) left untouched
 * expired  : enabled one-shot schedules whose time passed while the process was down; now disabled
 */
public record RestoreResult(
        int restored,
        int skipped,
        int expired
) {

    public static RestoreResult empty() {
        return new RestoreResult(0, 0, 0);
    }
}
