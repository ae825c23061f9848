package com.purchasingpower.forge.exception;

import lombok.Getter;

@Getter
public class InvalidToolArgumentsException extends RuntimeException {

    private final String toolName;

    public InvalidToolArgumentsException(String toolName, String message) {
        super("Invalid arguments for " + toolName + ": " + message);
        this.toolName = toolName;
    }
}
