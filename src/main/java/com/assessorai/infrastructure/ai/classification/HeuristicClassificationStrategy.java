package com.assessorai.infrastructure.ai.classification;

import com.assessorai.domain.pipeline.model.DocumentType;
import com.assessorai.domain.pipeline.model.InputDocument;
import com.assessorai.domain.pipeline.model.RunConfiguration;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Regex heuristic over the head of the text. Score per type is
 * matches / max(patterns * 0.3, 1), capped at 1.
 */
@Slf4j
public class HeuristicClassificationStrategy implements ClassificationStrategy {

    static final int SCAN_CHARS = 5000;
    private static final double EXPECTED_MATCH_SHARE = 0.3;

    private final List<Pattern> primaryPatterns;
    private final List<Pattern> supportingPatterns;

    public HeuristicClassificationStrategy(List<String> primaryPatterns, List<String> supportingPatterns) {
        this.primaryPatterns = compile(primaryPatterns);
        this.supportingPatterns = compile(supportingPatterns);
    }

    @Override
    public String name() {
        return "heuristic";
    }

    @Override
    public Optional<ClassificationVerdict> classify(InputDocument document, RunConfiguration config, Instant deadline) {
        String text = document.extractedText() == null ? "" : document.extractedText();
        String head = text.length() > SCAN_CHARS ? text.substring(0, SCAN_CHARS) : text;
        double primary = score(head, primaryPatterns);
        double supporting = score(head, supportingPatterns);
        log.debug("[Classifier] heuristic {}: primary={} supporting={}", document.id(), primary, supporting);
        if (primary == 0.0 && supporting == 0.0) {
            return Optional.empty();
        }
        if (primary == supporting) {
            return Optional.of(ClassificationVerdict.heuristic(DocumentType.UNKNOWN, 0.0, name()));
        }
        return primary > supporting
                ? Optional.of(ClassificationVerdict.heuristic(DocumentType.PRIMARY, primary, name()))
                : Optional.of(ClassificationVerdict.heuristic(DocumentType.SUPPORTING, supporting, name()));
    }

    private double score(String text, List<Pattern> patterns) {
        if (patterns.isEmpty()) {
            return 0.0;
        }
        long matches = patterns.stream().filter(p -> p.matcher(text).find()).count();
        return Math.min(1.0, matches / Math.max(patterns.size() * EXPECTED_MATCH_SHARE, 1.0));
    }

    private static List<Pattern> compile(List<String> patterns) {
        return patterns.stream()
                .filter(p -> !p.isBlank())
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }
}
