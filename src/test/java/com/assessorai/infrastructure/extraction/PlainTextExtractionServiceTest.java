package com.assessorai.infrastructure.extraction;

import com.assessorai.domain.pipeline.model.InputDocument;
import com.assessorai.domain.pipeline.service.ExtractionException;
import com.assessorai.domain.pipeline.service.ExtractionService.ExtractedText;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PlainTextExtractionServiceTest {

    private final PlainTextExtractionService service = new PlainTextExtractionService();

    @TempDir
    Path dir;

    @Test
    @DisplayName("Form feeds split pages and each page gets its own quality")
    void splits_pages_on_form_feed() throws Exception {
        Path file = dir.resolve("recurso.txt");
        Files.writeString(file, "Recurso especial interposto\f#$%&*@!~^", StandardCharsets.UTF_8);

        ExtractedText extracted = service.extract(InputDocument.unclassified("doc-01", file.toString()));

        assertThat(extracted.pageCount()).isEqualTo(2);
        assertThat(extracted.perPageQuality()).hasSize(2);
        assertThat(extracted.perPageQuality().get(0)).isEqualTo(1.0);
        assertThat(extracted.perPageQuality().get(1)).isEqualTo(0.0);
        assertThat(extracted.text()).doesNotContain("\f").startsWith("Recurso especial interposto\n");
    }

    @Test
    @DisplayName("Blank pages score zero and mixed pages score their clean share")
    void page_quality() {
        assertThat(PlainTextExtractionService.pageQuality("   ")).isZero();
        assertThat(PlainTextExtractionService.pageQuality("ab##")).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("An unreadable input raises ExtractionException naming the document")
    void missing_file() {
        InputDocument document = InputDocument.unclassified("doc-09", dir.resolve("absent.txt").toString());

        assertThatThrownBy(() -> service.extract(document))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("doc-09");
    }
}
