package com.assessorai.infrastructure.taxonomy;

import com.assessorai.domain.pipeline.service.ReferenceTaxonomy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Versioned, configured set of recognized citation identifiers in canonical
 * {@code COURT-NUMBER} form. Free-text citations such as "Súmula 7/STJ" are
 * canonicalized before lookup.
 */
@Slf4j
@Component
public class StaticReferenceTaxonomy implements ReferenceTaxonomy {

    private static final Pattern CITATION = Pattern.compile(
            "(?iu)s[uú]mula\\s*(?:vinculante\\s*)?(?:n[.ºo°]*\\s*)?(\\d+)\\s*(?:/|\\s|do|da)*\\s*(STJ|STF)");
    private static final Pattern CANONICAL = Pattern.compile("(?i)(STJ|STF)\\s*-\\s*(\\d+)");

    private final Set<String> recognized;
    private final String version;

    public StaticReferenceTaxonomy(@Value("${assessor.taxonomy.recognized:}") List<String> recognized,
                                   @Value("${assessor.taxonomy.version:unversioned}") String version) {
        this.recognized = recognized.stream()
                .map(StaticReferenceTaxonomy::canonical)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        this.version = version;
        log.info("Reference taxonomy {} loaded with {} entries", version, this.recognized.size());
    }

    @Override
    public boolean isRecognized(String citationId) {
        return citationId != null && recognized.contains(canonical(citationId));
    }

    @Override
    public String version() {
        return version;
    }

    static String canonical(String citation) {
        String trimmed = citation.trim();
        Matcher canonical = CANONICAL.matcher(trimmed);
        if (canonical.matches()) {
            return canonical.group(1).toUpperCase(Locale.ROOT) + "-" + Integer.parseInt(canonical.group(2));
        }
        Matcher freeText = CITATION.matcher(trimmed);
        if (freeText.find()) {
            return freeText.group(2).toUpperCase(Locale.ROOT) + "-" + Integer.parseInt(freeText.group(1));
        }
        return trimmed.toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
