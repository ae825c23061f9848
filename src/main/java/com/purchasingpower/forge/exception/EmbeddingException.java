package com.purchasingpower.forge.exception;

import lombok.Getter;

@Getter
public class EmbeddingException extends RuntimeException {

    private final int statusCode;

    private final boolean retryable;

    public EmbeddingException(String message, int statusCode, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.retryable = false;
    }
}
