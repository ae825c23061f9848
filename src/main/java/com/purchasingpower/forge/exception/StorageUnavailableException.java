package com.purchasingpower.forge.exception;

import lombok.Getter;

/**
 * The local storage layer cannot be read or written. The only failure that aborts a turn.
 */
@Getter
public class StorageUnavailableException extends RuntimeException {

    private final String location;

    public StorageUnavailableException(String location, Throwable cause) {
        super("Storage unavailable at " + location, cause);
        this.location = location;
    }
}
