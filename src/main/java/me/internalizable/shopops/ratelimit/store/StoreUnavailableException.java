package me.internalizable.shopops.ratelimit.store;

import lombok.Getter;

/**
 * Thrown when the backing counter store cannot be read or written.
 */
@Getter
public class StoreUnavailableException extends RuntimeException {

    private final String key;

    public StoreUnavailableException(String key, Throwable cause) {
        super("Counter store unavailable for key: " + key, cause);
        this.key = key;
    }
}
