package com.assessorai.infrastructure.instructions;

import com.assessorai.domain.pipeline.model.StageId;
import com.assessorai.domain.pipeline.service.InstructionSetProvider;
import com.assessorai.infrastructure.ai.cache.CacheKeyBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads instruction sets from {@code <location>/<profile>/<stage>.md}. The version is
 * the content hash, so a changed file yields a new version (and new cache keys)
 * independent of file timestamps.
 */
@Slf4j
@Component
public class ClasspathInstructionSetProvider implements InstructionSetProvider {

    private final ResourceLoader resourceLoader;
    private final CacheKeyBuilder hasher;
    private final String location;
    private final Map<String, InstructionSet> cache = new ConcurrentHashMap<>();

    public ClasspathInstructionSetProvider(ResourceLoader resourceLoader,
                                           CacheKeyBuilder hasher,
                                           @Value("${assessor.instructions.location:classpath:instructions}") String location) {
        this.resourceLoader = resourceLoader;
        this.hasher = hasher;
        this.location = location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
    }

    @Override
    public InstructionSet loadInstructions(StageId stageId, String profile) {
        return cache.computeIfAbsent(path(stageId, profile), this::read);
    }

    /**
     * Re-reads every cached set and replaces those whose hash changed.
     *
     * @return number of sets that changed
     */
    @Scheduled(fixedDelayString = "${assessor.instructions.refresh-interval-ms:60000}")
    public int refresh() {
        int changed = 0;
        for (Map.Entry<String, InstructionSet> entry : cache.entrySet()) {
            InstructionSet current = read(entry.getKey());
            if (!current.version().equals(entry.getValue().version())) {
                cache.put(entry.getKey(), current);
                log.info("[Instructions] {} changed: {} -> {}", entry.getKey(),
                        shortVersion(entry.getValue().version()), shortVersion(current.version()));
                changed++;
            }
        }
        return changed;
    }

    private InstructionSet read(String path) {
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            throw new IllegalStateException("Instruction set not found: " + path);
        }
        try (InputStream in = resource.getInputStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return new InstructionSet(text, hasher.hash(text));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read instruction set " + path, e);
        }
    }

    private String path(StageId stageId, String profile) {
        return location + "/" + profile + "/" + stageId.resourceName() + ".md";
    }

    private static String shortVersion(String version) {
        return version.substring(0, Math.min(12, version.length()));
    }
}
