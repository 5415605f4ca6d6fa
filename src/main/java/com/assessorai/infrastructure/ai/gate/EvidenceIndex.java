package com.assessorai.infrastructure.ai.gate;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalized view of a source text for verbatim-or-normalized substring checks.
 * Evidence quoted with ellipses matches when every quoted part is found.
 */
public final class EvidenceIndex {

    private static final Pattern ELLIPSIS =
            Pattern.compile("\\s*(?:\\[\\s*\\.\\.\\.\\s*]|\\(\\s*\\.\\.\\.\\s*\\)|\\.\\.\\.|…)\\s*");
    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern QUOTES = Pattern.compile("[\"'“”‘’«»]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String source;
    private final String normalizedSource;

    public EvidenceIndex(String source) {
        this.source = source == null ? "" : source;
        this.normalizedSource = normalize(this.source);
    }

    public boolean contains(String evidence) {
        if (evidence == null || evidence.isBlank()) {
            return false;
        }
        if (source.contains(evidence)) {
            return true;
        }
        int matched = 0;
        for (String part : ELLIPSIS.split(evidence)) {
            String needle = normalize(part);
            if (needle.isEmpty()) {
                continue;
            }
            if (!normalizedSource.contains(needle)) {
                return false;
            }
            matched++;
        }
        return matched > 0;
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String stripped = MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
        String unquoted = QUOTES.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll("");
        return WHITESPACE.matcher(unquoted).replaceAll(" ").trim();
    }
}
