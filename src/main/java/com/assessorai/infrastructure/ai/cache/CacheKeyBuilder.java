package com.assessorai.infrastructure.ai.cache;

import com.assessorai.domain.pipeline.model.StageId;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic SHA-256 fingerprints of model inputs and instruction sets.
 */
@Component
public class CacheKeyBuilder {

    /**
     * Fingerprint of everything the model sees for one call besides the instructions.
     */
    public String fingerprint(StageId stageId, String payload) {
        return sha256(stageId.name() + "|" + (payload != null ? payload : ""));
    }

    public CacheKey key(StageId stageId, String payload, String instructionVersion, String modelId) {
        return new CacheKey(fingerprint(stageId, payload), instructionVersion, modelId, stageId);
    }

    /**
     * Hash of joined parts, used for content versions and prompt signatures.
     */
    public String hash(String... parts) {
        return sha256(String.join("|", parts));
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
