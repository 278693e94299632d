package com.releasewatch.core.model;

import java.time.Instant;

public record SeenItem(String id, String fingerprint, Instant timestamp) {
}
