package me.internalizable.shopops.identity;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves which identity a request is counted against.
 *
 * Sources are tried in {@link #RESOLUTION_ORDER}; the first one present wins:
 * authenticated user, then device id (query parameter before header), then source address.
 */
@Component
public class ClientIdentityResolver {

    public static final String DEVICE_ID_PARAM = "device_id";
    public static final String DEVICE_ID_HEADER = "X-Device-ID";
    static final String UNKNOWN_ADDRESS = "unknown";

    public static final List<IdentitySource> RESOLUTION_ORDER = List.of(
            IdentitySource.USER,
            IdentitySource.DEVICE,
            IdentitySource.ADDRESS
    );

    public ClientIdentity resolve(RequestSignals signals) {
        for (IdentitySource source : RESOLUTION_ORDER) {
            Optional<ClientIdentity> identity = source.resolve(signals);
            if (identity.isPresent()) {
                return identity.get();
            }
        }
        // ADDRESS always resolves
        return ClientIdentity.ip(UNKNOWN_ADDRESS);
    }

    public Optional<ClientIdentity> resolveDevice(RequestSignals signals) {
        return IdentitySource.DEVICE.resolve(signals);
    }

    /**
     * One place identity can come from.
     */
    public enum IdentitySource {

        USER(signals -> present(signals.userId()).map(ClientIdentity::user)),
        DEVICE(signals -> present(signals.deviceIdParam())
                .or(() -> present(signals.deviceIdHeader()))
                .map(ClientIdentity::device)),
        ADDRESS(signals -> Optional.of(ClientIdentity.ip(
                present(signals.remoteAddress()).orElse(UNKNOWN_ADDRESS))));

        private final Function<RequestSignals, Optional<ClientIdentity>> resolver;

        IdentitySource(Function<RequestSignals, Optional<ClientIdentity>> resolver) {
            this.resolver = resolver;
        }

        public Optional<ClientIdentity> resolve(RequestSignals signals) {
            if (signals == null) {
                return Optional.empty();
            }
            return resolver.apply(signals);
        }
    }

    private static Optional<String> present(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }
}
