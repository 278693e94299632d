package com.releasewatch.core.model;

import java.util.Optional;

public enum ReleaseStage {
    ANNOUNCED,
    LAUNCHED,
    UPDATED,
    UNKNOWN;

    /**
     * Name usable in routing and mention configuration, e.g. {@code release_launched}.
     */
    public Optional<String> alias() {
        return switch (this) {
            case ANNOUNCED -> Optional.of("release_announced");
            case LAUNCHED -> Optional.of("release_launched");
            default -> Optional.empty();
        };
    }
}
