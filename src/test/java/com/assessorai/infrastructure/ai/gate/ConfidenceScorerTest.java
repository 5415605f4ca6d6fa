package com.assessorai.infrastructure.ai.gate;

import com.assessorai.domain.pipeline.model.FieldValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();

    @Test
    @DisplayName("With every check passing the self-reported confidence is kept")
    void all_checks_pass() {
        FieldValue value = new FieldValue("Recurso especial", "recurso especial", 0.9, List.of());

        assertThat(scorer.score(value, true, true)).isCloseTo(0.9, within(1e-9));
    }

    @Test
    @DisplayName("Two failed checks out of three cap the score by the penalty curve")
    void two_failed_checks() {
        FieldValue value = new FieldValue("Recurso especial", "", 0.9, List.of());

        assertThat(scorer.score(value, false, true)).isCloseTo(0.3348, within(0.001));
    }

    @Test
    @DisplayName("Every check failing scores zero")
    void all_checks_fail() {
        FieldValue value = new FieldValue("Recurso especial", "", 1.0, List.of("STJ-999"));

        assertThat(scorer.score(value, false, false)).isZero();
    }

    @Test
    @DisplayName("An inconclusive answer loses a further 0.35")
    void inconclusive_penalty() {
        FieldValue value = new FieldValue("Tema não identificado", "trecho", 0.9, List.of());

        assertThat(scorer.inconclusive(value.content())).isTrue();
        assertThat(scorer.score(value, true, true)).isCloseTo(0.55, within(1e-9));
        assertThat(scorer.inconclusive("")).isTrue();
        assertThat(scorer.inconclusive("Provimento negado")).isFalse();
    }

    @Test
    @DisplayName("Global confidence weighs the stages 0.35 / 0.35 / 0.30")
    void global_weights() {
        assertThat(scorer.global(1.0, 1.0, 1.0)).isCloseTo(1.0, within(1e-9));
        assertThat(scorer.global(0.8, 0.6, 1.0)).isCloseTo(0.79, within(1e-9));
        assertThat(scorer.mean(List.of())).isZero();
        assertThat(scorer.mean(List.of(0.5, 1.0))).isCloseTo(0.75, within(1e-9));
    }
}
