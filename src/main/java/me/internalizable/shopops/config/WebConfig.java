package me.internalizable.shopops.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.internalizable.shopops.identity.ClientIdentityResolver;
import me.internalizable.shopops.ratelimit.EndpointClass;
import me.internalizable.shopops.ratelimit.RateLimitService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Maps each endpoint class onto its request paths. Every request is governed by exactly one
 * class: the general limit skips the paths owned by the export, sync and restore limiters.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final RateLimitService rateLimitService;
    private final ClientIdentityResolver identityResolver;
    private final ObjectMapper objectMapper;

    @Value("${rate-limit.paths.general:/api/**}")
    private String[] generalPaths;

    @Value("${rate-limit.paths.export:/api/export/**}")
    private String[] exportPaths;

    @Value("${rate-limit.paths.sync:/api/sync/**}")
    private String[] syncPaths;

    @Value("${rate-limit.paths.restore:/api/restore/**}")
    private String[] restorePaths;

    @Value("${rate-limit.paths.excluded:/api/health}")
    private String[] excludedPaths;

    public WebConfig(RateLimitService rateLimitService,
                     ClientIdentityResolver identityResolver,
                     ObjectMapper objectMapper) {
        this.rateLimitService = rateLimitService;
        this.identityResolver = identityResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        List<String> owned = new ArrayList<>();
        owned.addAll(Arrays.asList(exportPaths));
        owned.addAll(Arrays.asList(syncPaths));
        owned.addAll(Arrays.asList(restorePaths));

        register(registry, EndpointClass.GENERAL, generalPaths).excludePathPatterns(owned);
        register(registry, EndpointClass.EXPORT, exportPaths);
        register(registry, EndpointClass.SYNC, syncPaths);
        register(registry, EndpointClass.RESTORE, restorePaths);
    }

    private InterceptorRegistration register(InterceptorRegistry registry, EndpointClass endpointClass, String[] paths) {
        return registry.addInterceptor(new RateLimitInterceptor(rateLimitService, identityResolver, endpointClass, objectMapper))
                .addPathPatterns(paths)
                .excludePathPatterns(excludedPaths);
    }
}
