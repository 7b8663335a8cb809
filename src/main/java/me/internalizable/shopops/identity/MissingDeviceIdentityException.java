package me.internalizable.shopops.identity;

/**
 * The endpoint requires a device id and the request supplied none.
 * This is a client error, not a rate limit rejection.
 */
public class MissingDeviceIdentityException extends RuntimeException {

    public MissingDeviceIdentityException(String message) {
        super(message);
    }
}
