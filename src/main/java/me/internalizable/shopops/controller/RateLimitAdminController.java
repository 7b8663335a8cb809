package me.internalizable.shopops.controller;

import me.internalizable.shopops.ratelimit.EndpointClass;
import me.internalizable.shopops.ratelimit.RateLimitService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator endpoints for inspecting and clearing counters.
 */
@RestController
@RequestMapping("/admin/rate-limits")
public class RateLimitAdminController {

    private final RateLimitService rateLimitService;

    public RateLimitAdminController(RateLimitService rateLimitService) {
        this.rateLimitService = rateLimitService;
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        return rateLimitService.getStats();
    }

    /**
     * Reset one client's counter, e.g. {@code ?endpoint=export&key=user:42}
     */
    @DeleteMapping
    public Map<String, Object> reset(@RequestParam String endpoint, @RequestParam String key) {
        EndpointClass endpointClass = EndpointClass.fromId(endpoint);
        rateLimitService.resetLimit(endpointClass, key);
        return Map.of(
                "success", true,
                "endpoint", endpointClass.getId(),
                "key", key
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "success", false,
                "error", e.getMessage()
        ));
    }
}
