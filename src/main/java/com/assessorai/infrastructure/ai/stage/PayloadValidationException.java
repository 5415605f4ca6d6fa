package com.assessorai.infrastructure.ai.stage;

/**
 * Model answer that is not valid JSON or lacks required fields.
 */
public class PayloadValidationException extends RuntimeException {

    public PayloadValidationException(String message) {
        super(message);
    }

    public PayloadValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
