package me.internalizable.shopops.identity;

public record ClientIdentity(IdentityNamespace namespace, String value) {

    public ClientIdentity {
        if (namespace == null) {
            throw new IllegalArgumentException("namespace cannot be null");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("identity value must not be blank");
        }
    }

    public static ClientIdentity user(String id) {
        return new ClientIdentity(IdentityNamespace.USER, id);
    }

    public static ClientIdentity device(String id) {
        return new ClientIdentity(IdentityNamespace.DEVICE, id);
    }

    public static ClientIdentity ip(String address) {
        return new ClientIdentity(IdentityNamespace.IP, address);
    }

    /**
     * Base counter key, e.g. {@code user:42}.
     */
    public String key() {
        return namespace.getPrefix() + ":" + value;
    }
}
