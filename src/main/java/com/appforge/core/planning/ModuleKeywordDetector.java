package com.appforge.core.planning;

import com.appforge.core.model.TaskKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scans requirement text for keywords that call for optional modules and extracts
 * the significant terms used as feature hints.
 */
public final class ModuleKeywordDetector {

    private record ModulePattern(TaskKind kind, List<String> keywords) {}

    private static final List<ModulePattern> MODULE_PATTERNS = List.of(
            new ModulePattern(TaskKind.FRONTEND,
                    List.of("app", "ui", "web", "website", "site", "frontend", "front-end", "dashboard",
                            "page", "portal", "interface", "react", "vue", "angular", "mobile")),
            new ModulePattern(TaskKind.AUTH,
                    List.of("auth", "authentication", "login", "log in", "sign in", "signin", "sign up",
                            "signup", "oauth", "jwt", "sso", "password", "user accounts", "accounts"))
    );

    /** Phrases that rule out a user interface even when a frontend keyword appears. */
    private static final List<String> HEADLESS_PHRASES = List.of(
            "api only", "api-only", "headless", "backend only", "backend-only", "no ui", "no frontend");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "with", "for", "to", "of", "in", "on", "my", "me", "i",
            "we", "our", "it", "that", "this", "some", "something", "thing", "stuff", "build", "make",
            "create", "want", "need", "please", "should", "can", "could", "would", "be", "is", "are",
            "using", "use", "like", "just", "new", "simple", "basic", "good", "nice", "cool");

    private static final Pattern TOKEN = Pattern.compile("[a-z0-9][a-z0-9+#.-]*");

    private ModuleKeywordDetector() {} // utility class

    /**
     * Optional module kinds the text asks for. Backend and database are not reported;
     * the planner always includes them.
     */
    public static Set<TaskKind> detectModules(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        String lowerText = text.toLowerCase(Locale.ROOT);
        Set<TaskKind> detected = EnumSet.noneOf(TaskKind.class);
        for (ModulePattern pattern : MODULE_PATTERNS) {
            for (String keyword : pattern.keywords()) {
                if (matchesKeyword(lowerText, keyword)) {
                    detected.add(pattern.kind());
                    break;
                }
            }
        }
        if (HEADLESS_PHRASES.stream().anyMatch(lowerText::contains)) {
            detected.remove(TaskKind.FRONTEND);
        }
        return detected;
    }

    /**
     * Significant terms of the requirement in first-seen order, stop words removed.
     */
    public static List<String> significantTerms(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        var matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        Set<String> terms = new LinkedHashSet<>();
        while (matcher.find()) {
            String token = matcher.group().replaceAll("[.-]+$", "");
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                terms.add(token);
            }
        }
        return new ArrayList<>(terms);
    }

    private static boolean matchesKeyword(String lowerText, String keyword) {
        return Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b").matcher(lowerText).find();
    }
}
