package com.assessorai.infrastructure.ai.classification;

import com.assessorai.domain.pipeline.model.DocumentType;
import com.assessorai.domain.pipeline.model.InputDocument;
import com.assessorai.domain.pipeline.model.RunConfiguration;
import com.assessorai.domain.pipeline.model.TokenUsage;
import com.assessorai.support.TestConfigurations;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentClassifierTest {

    @Mock
    private ClassificationStrategy heuristic;

    @Mock
    private ClassificationStrategy model;

    private final RunConfiguration config = TestConfigurations.runConfiguration();
    private final InputDocument document = InputDocument.unclassified("doc-01", "doc-01.txt")
            .withExtraction("texto", 1, List.of(1.0));

    @Test
    @DisplayName("A confident heuristic verdict wins without calling the model")
    void heuristic_wins() {
        when(heuristic.classify(any(), any(), any())).thenReturn(
                Optional.of(ClassificationVerdict.heuristic(DocumentType.PRIMARY, 0.9, "heuristic")));

        DocumentClassifier.Classification result =
                new DocumentClassifier(List.of(heuristic, model)).classify(document, config, Instant.MAX);

        assertThat(result.verdict().type()).isEqualTo(DocumentType.PRIMARY);
        assertThat(result.consulted()).hasSize(1);
        verifyNoInteractions(model);
    }

    @Test
    @DisplayName("A weak heuristic verdict falls through to the model tier")
    void falls_through() {
        when(heuristic.classify(any(), any(), any())).thenReturn(
                Optional.of(ClassificationVerdict.heuristic(DocumentType.SUPPORTING, 0.4, "heuristic")));
        ClassificationVerdict modelVerdict = new ClassificationVerdict(DocumentType.SUPPORTING, 0.85, "model",
                new TokenUsage(300, 10), "gpt-4.1-mini");
        when(model.classify(any(), any(), any())).thenReturn(Optional.of(modelVerdict));

        DocumentClassifier.Classification result =
                new DocumentClassifier(List.of(heuristic, model)).classify(document, config, Instant.MAX);

        assertThat(result.verdict()).isEqualTo(modelVerdict);
        assertThat(result.consulted()).hasSize(2);
    }

    @Test
    @DisplayName("When no tier is confident the document stays UNKNOWN")
    void stays_unknown() {
        when(heuristic.classify(any(), any(), any())).thenReturn(Optional.empty());
        when(model.classify(any(), any(), any())).thenReturn(Optional.of(new ClassificationVerdict(
                DocumentType.PRIMARY, 0.5, "model", new TokenUsage(300, 10), "gpt-4.1-mini")));

        DocumentClassifier.Classification result =
                new DocumentClassifier(List.of(heuristic, model)).classify(document, config, Instant.MAX);

        assertThat(result.verdict().type()).isEqualTo(DocumentType.UNKNOWN);
        assertThat(result.verdict().confidence()).isEqualTo(0.5);
        assertThat(result.verdict().strategy()).isEqualTo("none");
        assertThat(result.consulted()).extracting(ClassificationVerdict::usage)
                .containsExactly(new TokenUsage(300, 10));
    }
}
