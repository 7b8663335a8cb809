package me.internalizable.shopops.identity;

import lombok.Getter;

/**
 * How a client was identified. The prefix is the first segment of every counter key.
 */
@Getter
public enum IdentityNamespace {

    USER("user"),
    DEVICE("device"),
    IP("ip");

    private final String prefix;

    IdentityNamespace(String prefix) {
        this.prefix = prefix;
    }
}
