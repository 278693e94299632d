package com.releasewatch.core.model;

import java.time.Instant;

/**
 * A complete read of current upstream state for one target. Watchers either return a whole
 * snapshot or fail; a partial snapshot is never handed to a diff engine.
 */
public interface Snapshot {
    SourceKind kind();

    Instant fetchedAt();
}
