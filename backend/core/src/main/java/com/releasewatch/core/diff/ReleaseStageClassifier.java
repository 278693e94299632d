package com.releasewatch.core.diff;

import com.releasewatch.core.model.Item;
import com.releasewatch.core.model.ReleaseStage;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Tells a teaser or pre-release apart from an actual launch using the item's text.
 */
public final class ReleaseStageClassifier {
    static final List<String> ANNOUNCEMENT_KEYWORDS = List.of(
            "coming soon", "announcing", "preview", "teaser", "upcoming",
            "will be released", "stay tuned", "sneak peek", "roadmap",
            "planned", "expected", "eta", "wip", "work in progress",
            "alpha", "beta", "rc", "release candidate", "pre-release"
    );
    static final List<String> LAUNCH_KEYWORDS = List.of(
            "released", "available now", "v1.", "v2.", "stable",
            "production ready", "ready to use", "download now",
            "install", "pip install", "weights released"
    );

    private final List<Pattern> announcementPatterns = compile(ANNOUNCEMENT_KEYWORDS);
    private final List<Pattern> launchPatterns = compile(LAUNCH_KEYWORDS);

    public ReleaseStage classify(Item item) {
        return switch (item.category()) {
            case RELEASE -> Boolean.TRUE.equals(item.metadata().get("prerelease"))
                    ? ReleaseStage.ANNOUNCED
                    : ReleaseStage.LAUNCHED;
            case REPOSITORY -> {
                if (Boolean.TRUE.equals(item.metadata().get("hasReleases"))) {
                    yield ReleaseStage.LAUNCHED;
                }
                ReleaseStage fromText = classifyText(item.title() + " " + item.metadata().getOrDefault("description", ""));
                yield fromText == ReleaseStage.UNKNOWN ? ReleaseStage.ANNOUNCED : fromText;
            }
            case COMMIT -> classifyText(item.title());
            default -> ReleaseStage.UNKNOWN;
        };
    }

    public ReleaseStage classifyText(String text) {
        if (text == null || text.isBlank()) {
            return ReleaseStage.UNKNOWN;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        if (announcementPatterns.stream().anyMatch(pattern -> pattern.matcher(lowered).find())) {
            return ReleaseStage.ANNOUNCED;
        }
        if (launchPatterns.stream().anyMatch(pattern -> pattern.matcher(lowered).find())) {
            return ReleaseStage.LAUNCHED;
        }
        return ReleaseStage.UNKNOWN;
    }

    // Whole-word match so that "rc" does not fire on "source".
    private static List<Pattern> compile(List<String> keywords) {
        return keywords.stream()
                .map(keyword -> {
                    String suffix = Character.isLetterOrDigit(keyword.charAt(keyword.length() - 1)) ? "(?![a-z0-9])" : "";
                    return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(keyword) + suffix);
                })
                .toList();
    }
}
