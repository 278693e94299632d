package com.releasewatch.service.support;

import com.releasewatch.core.model.Item;
import com.releasewatch.core.model.ItemSnapshot;
import com.releasewatch.core.model.Snapshot;
import com.releasewatch.core.model.SourceKind;
import com.releasewatch.core.model.WatchTarget;
import com.releasewatch.watchers.api.FetchException;
import com.releasewatch.watchers.api.SourceWatcher;
import com.releasewatch.watchers.api.WatchContext;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves whatever items a test has set per source id; a source id with a failure set throws.
 */
public class ScriptedWatcher implements SourceWatcher {
    private final SourceKind kind;
    private final Map<String, List<Item>> items = new ConcurrentHashMap<>();
    private final Map<String, String> failures = new ConcurrentHashMap<>();
    private final AtomicInteger fetches = new AtomicInteger();

    public ScriptedWatcher(SourceKind kind) {
        this.kind = kind;
    }

    public void items(String sourceId, List<Item> current) {
        items.put(sourceId, List.copyOf(current));
    }

    public void fail(String sourceId, String message) {
        failures.put(sourceId, message);
    }

    public void recover(String sourceId) {
        failures.remove(sourceId);
    }

    public int fetches() {
        return fetches.get();
    }

    @Override
    public SourceKind kind() {
        return kind;
    }

    @Override
    public Snapshot fetch(WatchTarget target, WatchContext context) throws FetchException {
        fetches.incrementAndGet();
        String failure = failures.get(target.sourceId());
        if (failure != null) {
            throw new FetchException(failure, 503, null);
        }
        return new ItemSnapshot(kind, items.getOrDefault(target.sourceId(), List.of()), context.clock().instant());
    }
}
