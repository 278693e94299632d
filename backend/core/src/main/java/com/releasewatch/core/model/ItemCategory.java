package com.releasewatch.core.model;

public enum ItemCategory {
    REPOSITORY,
    COMMIT,
    RELEASE,
    MODEL,
    PAPER,
    ARTICLE
}
