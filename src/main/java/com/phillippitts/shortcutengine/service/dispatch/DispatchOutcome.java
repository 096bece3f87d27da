package com.phillippitts.shortcutengine.service.dispatch;

/**
 * Result of one {@link DispatchTable#invoke(String)} call.
 *
 * @param shortcutId dispatched id
 * @param handlersInvoked number of handlers called
 * @param failures handlers that threw
 * @param durationNanos wall time spent in handlers
 */
public record DispatchOutcome(String shortcutId, int handlersInvoked, int failures, long durationNanos) {

    public boolean hadHandlers() {
        return handlersInvoked > 0;
    }
}
