package com.releasewatch.watchers.api;

import com.releasewatch.core.model.Snapshot;
import com.releasewatch.core.model.SourceKind;
import com.releasewatch.core.model.WatchTarget;

/**
 * Fetches the current state of one upstream source. A watcher either returns a complete
 * snapshot or throws; it never returns a partial one and never touches stored state.
 */
public interface SourceWatcher {
    SourceKind kind();

    Snapshot fetch(WatchTarget target, WatchContext ctx) throws FetchException;
}
