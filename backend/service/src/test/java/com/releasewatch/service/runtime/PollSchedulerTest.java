package com.releasewatch.service.runtime;

import com.releasewatch.core.bus.EventBus;
import com.releasewatch.core.diff.DiffEngine;
import com.releasewatch.core.diff.LeaderboardDiffEngine;
import com.releasewatch.core.events.AlertRaised;
import com.releasewatch.core.events.Event;
import com.releasewatch.core.events.SweepCompleted;
import com.releasewatch.core.events.SweepStarted;
import com.releasewatch.core.model.Item;
import com.releasewatch.core.model.ItemCategory;
import com.releasewatch.core.model.PriorityTier;
import com.releasewatch.core.model.SourceKind;
import com.releasewatch.core.model.WatchTarget;
import com.releasewatch.core.routing.EventRouter;
import com.releasewatch.core.routing.RoutingPolicy;
import com.releasewatch.service.store.JsonlOutbox;
import com.releasewatch.service.support.InMemoryStateStore;
import com.releasewatch.service.support.MutableClock;
import com.releasewatch.service.support.RecordingNotifier;
import com.releasewatch.service.support.ScriptedWatcher;
import com.releasewatch.watchers.api.WatchContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PollSchedulerTest {
    private static final Instant START = Instant.parse("2026-03-03T12:00:00Z");
    private static final WatchTarget QWEN = new WatchTarget("Qwen-Image", SourceKind.GITHUB, "QwenLM/Qwen-Image", PriorityTier.HIGH);
    private static final WatchTarget FLUX = new WatchTarget("FLUX.1", SourceKind.GITHUB, "black-forest-labs/flux", PriorityTier.NORMAL);

    private final MutableClock clock = new MutableClock(START);
    private final ScriptedWatcher github = new ScriptedWatcher(SourceKind.GITHUB);
    private final InMemoryStateStore store = new InMemoryStateStore();
    private final RecordingNotifier notifier = new RecordingNotifier();
    private final EventBus eventBus = new EventBus();
    private final List<Event> published = new CopyOnWriteArrayList<>();
    private final List<PollScheduler> schedulers = new ArrayList<>();

    @AfterEach
    void stopSchedulers() {
        schedulers.forEach(PollScheduler::shutdown);
    }

    @Test
    void failingPairDoesNotAffectOtherPairs() throws Exception {
        PollScheduler scheduler = scheduler(List.of(QWEN, FLUX));
        github.items("QwenLM/Qwen-Image", List.of(commit("q1", 1)));
        github.items("black-forest-labs/flux", List.of(commit("f1", 1)));
        scheduler.runOnce();

        github.fail("QwenLM/Qwen-Image", "HTTP 502");
        github.items("black-forest-labs/flux", List.of(commit("f1", 1), commit("f2", 2)));
        clock.advance(Duration.ofHours(1));
        SweepReport report = scheduler.runOnce();

        assertEquals(2, report.attempted());
        assertEquals(1, report.succeeded());
        assertEquals(1, report.failed());
        assertEquals(1, report.eventsDetected());
        assertEquals("f2", notifier.delivered().get(0).event().item().id());
        assertEquals(START, store.get(QWEN.entityKey()).orElseThrow().lastCheckedAt());
        assertTrue(published.stream()
                .filter(AlertRaised.class::isInstance)
                .map(AlertRaised.class::cast)
                .anyMatch(alert -> alert.category().equals(AlertRaised.FETCH)
                        && QWEN.entityKey().equals(alert.details().get("entityKey"))));
    }

    @Test
    void repeatedSweepsOverUnchangedUpstreamEmitNothing() throws Exception {
        PollScheduler scheduler = scheduler(List.of(QWEN));
        github.items("QwenLM/Qwen-Image", List.of(commit("q1", 1)));
        scheduler.runOnce();
        github.items("QwenLM/Qwen-Image", List.of(commit("q1", 1), commit("q2", 2)));

        assertEquals(1, scheduler.runOnce().eventsDetected());
        assertEquals(0, scheduler.runOnce().eventsDetected());
        assertEquals(0, scheduler.runOnce().eventsDetected());
        assertEquals(1, notifier.delivered().size());
        assertTrue(notifier.delivered().get(0).mentionChannel());
    }

    @Test
    void resetMakesTheNextSweepAFirstObservation() throws Exception {
        PollScheduler scheduler = scheduler(List.of(QWEN));
        github.items("QwenLM/Qwen-Image", List.of(commit("q1", 1)));
        scheduler.runOnce();

        store.reset();
        github.items("QwenLM/Qwen-Image", List.of(commit("q1", 1), commit("q2", 2)));
        SweepReport report = scheduler.runOnce();

        assertEquals(0, report.eventsDetected());
        assertTrue(notifier.delivered().isEmpty());
        assertEquals(2, store.get(QWEN.entityKey()).orElseThrow().payload().items().size());
    }

    @Test
    void sweepPublishesLifecycleEventsAroundThePairs() throws Exception {
        PollScheduler scheduler = scheduler(List.of(QWEN, FLUX));

        scheduler.runOnce();

        assertInstanceOf(SweepStarted.class, published.get(0));
        assertEquals(2, ((SweepStarted) published.get(0)).targets());
        SweepCompleted completed = (SweepCompleted) published.get(published.size() - 1);
        assertEquals(2, completed.attempted());
        assertEquals(2, completed.succeeded());
        assertEquals(SchedulerState.IDLE, scheduler.state());
    }

    @Test
    void pendingEventsAreRedeliveredAtTheStartOfTheNextSweep() throws Exception {
        PollScheduler scheduler = scheduler(List.of(QWEN));
        github.items("QwenLM/Qwen-Image", List.of(commit("q1", 1)));
        scheduler.runOnce();
        github.items("QwenLM/Qwen-Image", List.of(commit("q1", 1), commit("q2", 2)));
        notifier.failing(true);
        scheduler.runOnce();
        assertTrue(notifier.delivered().isEmpty());

        notifier.failing(false);
        SweepReport report = scheduler.runOnce();

        assertEquals(0, report.eventsDetected());
        assertEquals(1, notifier.delivered().size());
        assertEquals("q2", notifier.delivered().get(0).event().item().id());
    }

    @Test
    void startRunsTheFirstSweepImmediately() throws Exception {
        PollScheduler scheduler = scheduler(List.of(QWEN));
        CountDownLatch completed = new CountDownLatch(1);
        eventBus.subscribe(SweepCompleted.class, event -> completed.countDown());

        scheduler.start();

        assertTrue(completed.await(5, TimeUnit.SECONDS));
        assertEquals(1, github.fetches());
    }

    @Test
    void noPairsAreDispatchedAfterShutdown() throws Exception {
        PollScheduler scheduler = scheduler(List.of(QWEN, FLUX));
        scheduler.shutdown();

        SweepReport report = scheduler.runOnce();

        assertEquals(0, report.attempted());
        assertEquals(0, github.fetches());
        assertFalse(published.isEmpty());
    }

    private PollScheduler scheduler(List<WatchTarget> targets) throws Exception {
        eventBus.subscribe(Event.class, published::add);
        JsonlOutbox outbox = new JsonlOutbox(Files.createTempDirectory("scheduler-").resolve("outbox.jsonl"), clock);
        ChangePipeline pipeline = new ChangePipeline(
                List.of(github),
                new WatchContext(HttpClient.newHttpClient(), clock, Duration.ofSeconds(5), Map.of()),
                store,
                outbox,
                new DiffEngine(),
                new LeaderboardDiffEngine(),
                30,
                new EventRouter(new RoutingPolicy(null, null, null, null, null, Set.of("Qwen-Image"))),
                notifier,
                eventBus
        );
        PollScheduler scheduler = new PollScheduler(targets, pipeline, eventBus, clock, 2, Duration.ofHours(1));
        schedulers.add(scheduler);
        return scheduler;
    }

    private static Item commit(String sha, int minutes) {
        return Item.of(sha, ItemCategory.COMMIT, "commit " + sha, "", START.plus(Duration.ofMinutes(minutes)));
    }
}
