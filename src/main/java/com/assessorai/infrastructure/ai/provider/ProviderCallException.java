package com.assessorai.infrastructure.ai.provider;

import com.assessorai.domain.pipeline.model.ErrorKind;
import lombok.Getter;

/**
 * Provider failure already classified as TRANSIENT or FATAL.
 */
@Getter
public class ProviderCallException extends RuntimeException {

    private final ErrorKind kind;

    public ProviderCallException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProviderCallException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
