package com.assessorai.infrastructure.ai.gate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EvidenceIndexTest {

    private static final String SOURCE = """
            RECURSO ESPECIAL interposto com fundamento no art. 105, III, "a", da Constituição.
            Alega-se violação ao art. 489 do CPC.   O acórdão recorrido
            negou provimento à apelação.
            """;

    private final EvidenceIndex index = new EvidenceIndex(SOURCE);

    @Test
    @DisplayName("Verbatim excerpts match")
    void verbatim() {
        assertThat(index.contains("Alega-se violação ao art. 489 do CPC.")).isTrue();
    }

    @Test
    @DisplayName("Case, accents, quotes and whitespace are normalized")
    void normalized() {
        assertThat(index.contains("recurso especial interposto")).isTrue();
        assertThat(index.contains("o acordao recorrido negou provimento")).isTrue();
        assertThat(index.contains("art. 105, III, a, da Constituicao")).isTrue();
    }

    @Test
    @DisplayName("Excerpts quoted with ellipses match when every part is found")
    void ellipsis() {
        assertThat(index.contains("Recurso especial [...] violação ao art. 489")).isTrue();
        assertThat(index.contains("Recurso especial ... art. 1022 do CPC")).isFalse();
    }

    @Test
    @DisplayName("Blank or absent evidence never matches")
    void blank() {
        assertThat(index.contains("")).isFalse();
        assertThat(index.contains(null)).isFalse();
        assertThat(index.contains(" ... ")).isFalse();
        assertThat(new EvidenceIndex(null).contains("anything")).isFalse();
    }
}
