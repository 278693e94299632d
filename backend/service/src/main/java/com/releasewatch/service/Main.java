package com.releasewatch.service;

import com.releasewatch.core.bus.EventBus;
import com.releasewatch.core.diff.DiffEngine;
import com.releasewatch.core.diff.LeaderboardDiffEngine;
import com.releasewatch.core.diff.ReleaseStageClassifier;
import com.releasewatch.core.routing.EventRouter;
import com.releasewatch.core.state.PersistenceException;
import com.releasewatch.service.config.ConfigException;
import com.releasewatch.service.config.ConfigLoader;
import com.releasewatch.service.config.ReleaseWatchConfig;
import com.releasewatch.service.http.HttpClientFactory;
import com.releasewatch.service.notify.LoggingNotifier;
import com.releasewatch.service.notify.Notifier;
import com.releasewatch.service.notify.SlackWebhookNotifier;
import com.releasewatch.service.runtime.ChangePipeline;
import com.releasewatch.service.runtime.PollScheduler;
import com.releasewatch.service.runtime.SweepMonitor;
import com.releasewatch.service.runtime.SweepReport;
import com.releasewatch.service.store.JsonFileStateStore;
import com.releasewatch.service.store.JsonlOutbox;
import com.releasewatch.watchers.api.WatchContext;
import com.releasewatch.watchers.arxiv.ArxivWatcher;
import com.releasewatch.watchers.github.GitHubWatcher;
import com.releasewatch.watchers.huggingface.HuggingFaceWatcher;
import com.releasewatch.watchers.leaderboard.LeaderboardWatcher;
import com.releasewatch.watchers.modelscope.ModelScopeWatcher;
import com.releasewatch.watchers.news.NewsWatcher;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIG = 2;
    static final int UNHEALTHY_AFTER_SWEEPS = 3;
    static final String USAGE = "usage: release-watch [--once | --daemon | --reset | --test] [--config <path>]";

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        int code = run(args, System.getenv(), System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, Map<String, String> environment, PrintStream out, PrintStream err) throws InterruptedException {
        CliOptions options;
        ReleaseWatchConfig config;
        try {
            options = CliOptions.parse(args);
            config = ConfigLoader.load(options.configPath(), environment);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_CONFIG;
        } catch (ConfigException e) {
            err.println(e.getMessage());
            return EXIT_CONFIG;
        }

        try {
            if (options.mode() == CliOptions.Mode.RESET) {
                new JsonFileStateStore(config.statePathResolved()).reset();
                LOGGER.info("State reset: " + config.statePathResolved());
                return EXIT_OK;
            }
            if (options.mode() == CliOptions.Mode.TEST) {
                return testNotifications(config, environment, out, err);
            }
            EventBus eventBus = new EventBus();
            try (SweepMonitor monitor = new SweepMonitor(eventBus, UNHEALTHY_AFTER_SWEEPS)) {
                PollScheduler scheduler = createScheduler(config, environment, Clock.systemUTC(), eventBus);
                if (options.mode() == CliOptions.Mode.ONCE) {
                    try {
                        SweepReport report = scheduler.runOnce();
                        out.println(monitor.health().lastSummary());
                        return report.failed() == 0 ? EXIT_OK : EXIT_FAILURE;
                    } finally {
                        scheduler.shutdown();
                    }
                }
                runDaemon(scheduler);
                return EXIT_OK;
            }
        } catch (ConfigException e) {
            err.println(e.getMessage());
            return EXIT_CONFIG;
        } catch (PersistenceException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }
    }

    static PollScheduler createScheduler(ReleaseWatchConfig config, Map<String, String> environment, Clock clock, EventBus eventBus) {
        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(10), environment);

        WatchContext context = new WatchContext(httpClient, clock, config.requestTimeout(), tokens(environment));
        ChangePipeline pipeline = new ChangePipeline(
                List.of(
                        new GitHubWatcher(),
                        new HuggingFaceWatcher(),
                        new ModelScopeWatcher(),
                        new ArxivWatcher(),
                        new NewsWatcher(),
                        new LeaderboardWatcher()
                ),
                context,
                new JsonFileStateStore(config.statePathResolved()),
                new JsonlOutbox(config.outboxPathResolved(), clock),
                new DiffEngine(config.firstObservationPolicy(), new ReleaseStageClassifier(), config.seenRetention()),
                new LeaderboardDiffEngine(),
                config.leaderboards().maxRank(),
                new EventRouter(config.routingPolicy()),
                notifier(config, httpClient),
                eventBus
        );
        return new PollScheduler(config.targets(), pipeline, eventBus, clock, config.parallelism(), config.checkInterval());
    }

    static Notifier notifier(ReleaseWatchConfig config, HttpClient httpClient) {
        if (config.slackWebhookUrl().isBlank() && config.slackChannels().isEmpty()) {
            LOGGER.warning("No Slack webhook configured, notifications go to the log");
            return new LoggingNotifier();
        }
        return new SlackWebhookNotifier(httpClient, config.requestTimeout(), config.slackWebhookUrl(), config.slackChannels());
    }

    private static int testNotifications(ReleaseWatchConfig config, Map<String, String> environment,
                                         PrintStream out, PrintStream err) {
        Notifier notifier = notifier(config, HttpClientFactory.create(Duration.ofSeconds(10), environment));
        if (!(notifier instanceof SlackWebhookNotifier slack)) {
            err.println("No Slack webhook configured; set slack_webhook_url or SLACK_WEBHOOK_URL");
            return EXIT_FAILURE;
        }
        boolean allOk = true;
        for (SlackWebhookNotifier.WebhookCheck check : slack.testConnections()) {
            if (check.ok()) {
                out.println(check.channel() + ": OK");
            } else {
                allOk = false;
                err.println(check.channel() + ": FAILED (" + check.detail() + ")");
            }
        }
        return allOk ? EXIT_OK : EXIT_FAILURE;
    }

    private static Map<String, String> tokens(Map<String, String> environment) {
        Map<String, String> tokens = new HashMap<>();
        for (String name : List.of(WatchContext.GITHUB_TOKEN, WatchContext.HF_TOKEN, WatchContext.ARTIFICIAL_ANALYSIS_API_KEY)) {
            String value = environment.get(name);
            if (value != null && !value.isBlank()) {
                tokens.put(name, value);
            }
        }
        return tokens;
    }

    private static void runDaemon(PollScheduler scheduler) throws InterruptedException {
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down");
            scheduler.shutdown();
            stopped.countDown();
        }, "release-watch-shutdown"));
        scheduler.start();
        stopped.await();
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning(() -> "Unable to read logging.properties: " + e.getMessage());
        }
    }

    record CliOptions(Mode mode, Path configPath) {
        static final Path DEFAULT_CONFIG = Path.of("config.yaml");

        enum Mode {
            ONCE,
            DAEMON,
            RESET,
            TEST
        }

        static CliOptions parse(String[] args) {
            Mode mode = null;
            Path config = DEFAULT_CONFIG;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--once" -> mode = exclusive(mode, Mode.ONCE);
                    case "--daemon" -> mode = exclusive(mode, Mode.DAEMON);
                    case "--reset" -> mode = exclusive(mode, Mode.RESET);
                    case "--test", "-t" -> mode = exclusive(mode, Mode.TEST);
                    case "--config" -> {
                        if (i + 1 >= args.length || args[i + 1].isBlank()) {
                            throw new IllegalArgumentException("--config requires a path");
                        }
                        config = Path.of(args[++i]);
                    }
                    default -> throw new IllegalArgumentException("Unknown argument: " + arg);
                }
            }
            return new CliOptions(mode == null ? Mode.ONCE : mode, config);
        }

        private static Mode exclusive(Mode current, Mode requested) {
            if (current != null && current != requested) {
                throw new IllegalArgumentException("Only one of --once, --daemon, --reset, --test may be given");
            }
            return requested;
        }
    }
}
