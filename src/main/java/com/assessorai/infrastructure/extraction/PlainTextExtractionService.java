package com.assessorai.infrastructure.extraction;

import com.assessorai.domain.pipeline.model.InputDocument;
import com.assessorai.domain.pipeline.service.ExtractionException;
import com.assessorai.domain.pipeline.service.ExtractionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads pre-extracted UTF-8 text where pages are separated by form feeds.
 * Page quality is the share of letters, digits and whitespace on the page.
 */
@Slf4j
@Component
public class PlainTextExtractionService implements ExtractionService {

    private static final String PAGE_BREAK = "\f";

    @Override
    public ExtractedText extract(InputDocument document) {
        Path path = Path.of(document.rawRef());
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExtractionException("Cannot read input " + document.id() + " at " + path, e);
        }
        String[] pages = text.split(PAGE_BREAK, -1);
        List<Double> quality = new ArrayList<>(pages.length);
        for (String page : pages) {
            quality.add(pageQuality(page));
        }
        log.info("[Extraction] {}: {} page(s), {} chars", document.id(), pages.length, text.length());
        return new ExtractedText(text.replace(PAGE_BREAK, "\n"), quality, pages.length);
    }

    static double pageQuality(String page) {
        if (page.isBlank()) {
            return 0.0;
        }
        long good = page.codePoints()
                .filter(c -> Character.isLetterOrDigit(c) || Character.isWhitespace(c))
                .count();
        return (double) good / page.codePointCount(0, page.length());
    }
}
