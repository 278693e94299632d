package com.releasewatch.service.runtime;

import com.releasewatch.core.model.WatchTarget;

/**
 * Outcome of one successfully fetched pair. {@code stateCommitted} is false when the store
 * write failed; the detected events were still handed to the notifier.
 */
public record PairResult(WatchTarget target, int eventsDetected, int delivered, boolean stateCommitted) {
}
