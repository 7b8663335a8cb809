package me.internalizable.shopops.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import me.internalizable.shopops.dto.RateLimitErrorResponse;
import me.internalizable.shopops.identity.ClientIdentity;
import me.internalizable.shopops.identity.ClientIdentityResolver;
import me.internalizable.shopops.identity.MissingDeviceIdentityException;
import me.internalizable.shopops.identity.RequestSignals;
import me.internalizable.shopops.ratelimit.EndpointClass;
import me.internalizable.shopops.ratelimit.Rate;
import me.internalizable.shopops.ratelimit.RateLimitDecision;
import me.internalizable.shopops.ratelimit.RateLimitService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.security.Principal;
import java.time.format.DateTimeFormatter;

/**
 * Applies one endpoint class's limit to the requests it is mapped to and renders the decision
 * as X-RateLimit-* headers, a 429 on rejection, or a 400 when a required device id is missing.
 */
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitInterceptor.class);

    public static final String USER_ID_ATTRIBUTE = "userId";

    private final RateLimitService rateLimitService;
    private final ClientIdentityResolver identityResolver;
    private final EndpointClass endpointClass;
    private final ObjectMapper objectMapper;

    public RateLimitInterceptor(RateLimitService rateLimitService,
                                ClientIdentityResolver identityResolver,
                                EndpointClass endpointClass,
                                ObjectMapper objectMapper) {
        this.rateLimitService = rateLimitService;
        this.identityResolver = identityResolver;
        this.endpointClass = endpointClass;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        RequestSignals signals = extractSignals(request);

        RateLimitDecision decision;
        try {
            decision = rateLimitService.check(endpointClass, signals);
        } catch (MissingDeviceIdentityException e) {
            writeJson(response, HttpStatus.BAD_REQUEST, RateLimitErrorResponse.badRequest(e.getMessage()));
            return false;
        }

        if (decision.failOpen()) {
            return true;
        }

        response.setHeader("X-RateLimit-Limit", String.valueOf(decision.limit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(decision.remaining()));
        response.setHeader("X-RateLimit-Reset", String.valueOf(decision.resetAfterSeconds()));

        if (decision.reached()) {
            response.setHeader("Retry-After", String.valueOf(decision.resetAfterSeconds()));
            logger.debug("Rejected {} request to {}", endpointClass.getId(), request.getRequestURI());
            writeJson(response, HttpStatus.TOO_MANY_REQUESTS, rejection(decision, signals));
            return false;
        }

        return true;
    }

    private RateLimitErrorResponse rejection(RateLimitDecision decision, RequestSignals signals) {
        Rate rate = rateLimitService.limiter(endpointClass).getRate();
        String resetAt = DateTimeFormatter.ISO_INSTANT.format(decision.resetAt());

        if (endpointClass.isDeviceRequired()) {
            String deviceId = identityResolver.resolveDevice(signals).map(ClientIdentity::value).orElse(null);
            return RateLimitErrorResponse.limitExceeded(
                    rejectionMessage(rate), decision.resetAfterSeconds(), decision.limit(), resetAt, deviceId);
        }
        return RateLimitErrorResponse.limitExceeded(
                rejectionMessage(rate), decision.resetAfterSeconds(), decision.limit(), resetAt);
    }

    private String rejectionMessage(Rate rate) {
        String subject = endpointClass == EndpointClass.GENERAL
                ? "Rate limit"
                : Character.toUpperCase(endpointClass.getId().charAt(0)) + endpointClass.getId().substring(1) + " rate limit";
        return String.format("%s exceeded. Maximum %d %s per %s%s.",
                subject,
                rate.limit(),
                rate.limit() == 1 ? singular(endpointClass.getNoun()) : endpointClass.getNoun(),
                rate.describePeriod(),
                endpointClass.isDeviceRequired() ? " per device" : "");
    }

    private static String singular(String noun) {
        return noun.endsWith("s") ? noun.substring(0, noun.length() - 1) : noun;
    }

    private void writeJson(HttpServletResponse response, HttpStatus status, RateLimitErrorResponse body) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    static RequestSignals extractSignals(HttpServletRequest request) {
        return new RequestSignals(
                getUserId(request),
                request.getParameter(ClientIdentityResolver.DEVICE_ID_PARAM),
                request.getHeader(ClientIdentityResolver.DEVICE_ID_HEADER),
                getClientIp(request)
        );
    }

    private static String getUserId(HttpServletRequest request) {
        Object userId = request.getAttribute(USER_ID_ATTRIBUTE);
        if (userId != null) {
            return userId.toString();
        }
        Principal principal = request.getUserPrincipal();
        return principal != null ? principal.getName() : null;
    }

    private static String getClientIp(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }

        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp;
        }

        return request.getRemoteAddr();
    }
}
