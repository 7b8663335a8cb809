package me.internalizable.shopops.ratelimit;

import me.internalizable.shopops.identity.ClientIdentity;
import me.internalizable.shopops.identity.ClientIdentityResolver;
import me.internalizable.shopops.identity.MissingDeviceIdentityException;
import me.internalizable.shopops.identity.RequestSignals;
import me.internalizable.shopops.ratelimit.store.WindowCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rate limiting service with one limiter per endpoint class, all sharing one counter store.
 *
 * Configuration (application.properties):
 * - rate-limit.enabled: Enable/disable rate limiting
 * - rate-limit.general: General API limit (default 100-M)
 * - rate-limit.export: Export limit (default 10-H)
 * - rate-limit.sync: Sync limit (default 60-M)
 * - rate-limit.restore: Restore limit per device (default 1-H)
 */
@Service
public class RateLimitService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitService.class);

    private final WindowCounterStore store;
    private final ClientIdentityResolver identityResolver;
    private final Clock clock;
    private final boolean enabled;
    private final Map<EndpointClass, RateLimiter> limiters;

    @Autowired
    public RateLimitService(
            WindowCounterStore store,
            ClientIdentityResolver identityResolver,
            Clock clock,
            @Value("${rate-limit.enabled:true}") boolean enabled,
            @Value("${rate-limit.general:100-M}") String generalRate,
            @Value("${rate-limit.export:10-H}") String exportRate,
            @Value("${rate-limit.sync:60-M}") String syncRate,
            @Value("${rate-limit.restore:1-H}") String restoreRate) {
        this(store, identityResolver, clock, enabled, Map.of(
                EndpointClass.GENERAL, Rate.parse(generalRate),
                EndpointClass.EXPORT, Rate.parse(exportRate),
                EndpointClass.SYNC, Rate.parse(syncRate),
                EndpointClass.RESTORE, Rate.parse(restoreRate)));
    }

    public RateLimitService(
            WindowCounterStore store,
            ClientIdentityResolver identityResolver,
            Clock clock,
            boolean enabled,
            Map<EndpointClass, Rate> rates) {
        this.store = store;
        this.identityResolver = identityResolver;
        this.clock = clock;
        this.enabled = enabled;

        Map<EndpointClass, RateLimiter> byClass = new EnumMap<>(EndpointClass.class);
        for (EndpointClass endpointClass : EndpointClass.values()) {
            Rate rate = rates.getOrDefault(endpointClass, Rate.parse(endpointClass.getDefaultRate()));
            byClass.put(endpointClass,
                    new RateLimiter(endpointClass.getId(), rate, endpointClass.getKeySuffix(), store, clock));
            logger.info("Rate limit for {} endpoints: {}", endpointClass.getId(), rate.describe());
        }
        this.limiters = Collections.unmodifiableMap(byClass);

        if (!enabled) {
            logger.warn("Rate limiting is disabled, all requests will be admitted");
        }
    }

    /**
     * Count a request against its endpoint class and decide whether it may proceed.
     *
     * @throws MissingDeviceIdentityException if limiting is enabled, the class requires a device id
     *         and none was sent; no counter is touched in that case
     */
    public RateLimitDecision check(EndpointClass endpointClass, RequestSignals signals) {
        RateLimiter limiter = limiters.get(endpointClass);
        if (!enabled) {
            return RateLimitDecision.failOpen(limiter.getRate().limit(), clock.instant());
        }

        return limiter.check(baseKey(endpointClass, signals));
    }

    public RateLimitDecision limitGeneral(RequestSignals signals) {
        return check(EndpointClass.GENERAL, signals);
    }

    public RateLimitDecision limitExports(RequestSignals signals) {
        return check(EndpointClass.EXPORT, signals);
    }

    public RateLimitDecision limitSync(RequestSignals signals) {
        return check(EndpointClass.SYNC, signals);
    }

    public RateLimitDecision limitRestore(RequestSignals signals) {
        return check(EndpointClass.RESTORE, signals);
    }

    /**
     * Identity key the class counts against, without the class suffix.
     */
    public String baseKey(EndpointClass endpointClass, RequestSignals signals) {
        if (endpointClass.isDeviceRequired()) {
            return identityResolver.resolveDevice(signals)
                    .map(ClientIdentity::key)
                    .orElseThrow(() -> new MissingDeviceIdentityException(
                            "Device ID is required for " + endpointClass.getId() + " operations. Provide via query param '"
                                    + ClientIdentityResolver.DEVICE_ID_PARAM + "' or header '"
                                    + ClientIdentityResolver.DEVICE_ID_HEADER + "'"));
        }
        return identityResolver.resolve(signals).key();
    }

    public RateLimiter limiter(EndpointClass endpointClass) {
        return limiters.get(endpointClass);
    }

    /**
     * Admin: Reset the counter of one client for one endpoint class
     */
    public void resetLimit(EndpointClass endpointClass, String baseKey) {
        String key = limiters.get(endpointClass).counterKey(baseKey);
        store.reset(key);
        logger.info("Rate limit reset for key: {} ({})", key, endpointClass.getId());
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("enabled", enabled);
        Map<String, String> rates = new LinkedHashMap<>();
        limiters.forEach((endpointClass, limiter) -> rates.put(endpointClass.getId(), limiter.getRate().describe()));
        stats.put("rates", rates);
        stats.put("store", store.getStats());
        return stats;
    }
}
