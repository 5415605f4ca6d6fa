package com.assessorai.infrastructure.ai.client;

import com.assessorai.domain.pipeline.model.ErrorKind;
import com.assessorai.domain.pipeline.model.InvocationAttempt;
import com.assessorai.domain.pipeline.model.TokenUsage;
import lombok.Getter;

import java.util.List;

/**
 * Invocation that could not produce an accepted response.
 * Only GATE_FAILURE (budget exhausted with partial output) and FATAL leave the client.
 */
@Getter
public class ModelInvocationException extends RuntimeException {

    private final ErrorKind kind;
    private final List<InvocationAttempt> attempts;
    private final String partialContent;

    public ModelInvocationException(ErrorKind kind, String message, List<InvocationAttempt> attempts,
                                    String partialContent) {
        super(message);
        this.kind = kind;
        this.attempts = List.copyOf(attempts);
        this.partialContent = partialContent;
    }

    public ModelInvocationException(ErrorKind kind, String message, List<InvocationAttempt> attempts,
                                    Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.attempts = List.copyOf(attempts);
        this.partialContent = null;
    }

    public TokenUsage usage() {
        return attempts.stream()
                .map(InvocationAttempt::usage)
                .filter(u -> u != null)
                .reduce(TokenUsage.ZERO, TokenUsage::plus);
    }
}
