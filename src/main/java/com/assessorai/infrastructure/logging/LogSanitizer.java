package com.assessorai.infrastructure.logging;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Redacts credentials and case identifiers from text that leaves the process
 * through logs, dead letters or API responses.
 */
public final class LogSanitizer {

    static final int MAX_LENGTH = 1200;
    static final String TRUNCATED_SUFFIX = " ... [TRUNCATED]";

    private record Rule(Pattern pattern, String replacement) {}

    // Order matters: OpenRouter keys share the sk- prefix.
    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("sk-or-[A-Za-z0-9_\\-]{8,}"), "sk-or-***"),
            new Rule(Pattern.compile("sk-[A-Za-z0-9_\\-]{8,}"), "sk-***"),
            new Rule(Pattern.compile("AIza[0-9A-Za-z_\\-]{20,}"), "AIza***"),
            new Rule(Pattern.compile("(?i)bearer\\s+[A-Za-z0-9._~+/=\\-]+"), "Bearer ***"),
            new Rule(Pattern.compile("\\b\\d{7}-\\d{2}\\.\\d{4}\\.\\d\\.\\d{2}\\.\\d{4}\\b"), "[PROCESS-NUMBER]")
    );

    private LogSanitizer() {
    }

    public static String sanitize(String text) {
        if (text == null) {
            return null;
        }
        String result = text;
        for (Rule rule : RULES) {
            result = rule.pattern().matcher(result).replaceAll(rule.replacement());
        }
        if (result.length() > MAX_LENGTH) {
            result = result.substring(0, MAX_LENGTH) + TRUNCATED_SUFFIX;
        }
        return result;
    }
}
