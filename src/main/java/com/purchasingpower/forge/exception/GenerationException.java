package com.purchasingpower.forge.exception;

import lombok.Getter;

@Getter
public class GenerationException extends RuntimeException {

    private final String model;

    public GenerationException(String model, String message, Throwable cause) {
        super(message, cause);
        this.model = model;
    }

    public GenerationException(String model, String message) {
        super(message);
        this.model = model;
    }
}
