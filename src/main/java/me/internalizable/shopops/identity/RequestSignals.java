package me.internalizable.shopops.identity;

/**
 * Raw identity signals extracted from an inbound request by the web layer.
 * Any field may be null when the request did not carry it.
 */
public record RequestSignals(
        String userId,
        String deviceIdParam,
        String deviceIdHeader,
        String remoteAddress
) {

    public static RequestSignals ofUser(String userId, String remoteAddress) {
        return new RequestSignals(userId, null, null, remoteAddress);
    }

    public static RequestSignals ofAddress(String remoteAddress) {
        return new RequestSignals(null, null, null, remoteAddress);
    }
}
