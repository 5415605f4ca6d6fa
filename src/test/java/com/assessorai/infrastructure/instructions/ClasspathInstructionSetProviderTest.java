package com.assessorai.infrastructure.instructions;

import com.assessorai.domain.pipeline.model.StageId;
import com.assessorai.domain.pipeline.service.InstructionSetProvider.InstructionSet;
import com.assessorai.infrastructure.ai.cache.CacheKeyBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClasspathInstructionSetProviderTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("The bundled default profile has an instruction set for every stage")
    void bundled_default_profile() {
        ClasspathInstructionSetProvider provider = new ClasspathInstructionSetProvider(
                new DefaultResourceLoader(), new CacheKeyBuilder(), "classpath:instructions/");

        for (StageId stage : StageId.values()) {
            InstructionSet set = provider.loadInstructions(stage, "default");
            assertThat(set.text()).isNotBlank();
            assertThat(set.version()).isNotBlank();
        }
    }

    @Test
    @DisplayName("Refresh picks up a changed file under a new version")
    void refresh_detects_content_change() throws Exception {
        Path file = Files.createDirectories(dir.resolve("strict")).resolve("stage1.md");
        Files.writeString(file, "Extract the appeal fields.", StandardCharsets.UTF_8);
        ClasspathInstructionSetProvider provider = new ClasspathInstructionSetProvider(
                new DefaultResourceLoader(), new CacheKeyBuilder(), dir.toUri().toString());

        InstructionSet before = provider.loadInstructions(StageId.STAGE1, "strict");
        assertThat(provider.refresh()).isZero();

        Files.writeString(file, "Extract the appeal fields. Quote evidence verbatim.", StandardCharsets.UTF_8);

        assertThat(provider.refresh()).isEqualTo(1);
        InstructionSet after = provider.loadInstructions(StageId.STAGE1, "strict");
        assertThat(after.version()).isNotEqualTo(before.version());
        assertThat(after.text()).endsWith("verbatim.");
    }

    @Test
    @DisplayName("A missing profile is a configuration error")
    void missing_profile() {
        ClasspathInstructionSetProvider provider = new ClasspathInstructionSetProvider(
                new DefaultResourceLoader(), new CacheKeyBuilder(), "classpath:instructions");

        assertThatThrownBy(() -> provider.loadInstructions(StageId.STAGE2, "nonexistent"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("nonexistent/stage2.md");
    }
}
