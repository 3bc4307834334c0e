package com.soora.shop.api.controller;

import com.soora.shop.api.dto.HealthResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Liveness endpoint for load balancers. Deeper checks live under /actuator/health.
 *
 * @author Soora Platform Team
 */
@RestController
public class HealthController {

    @Value("${app.health-message:Soora API is running}")
    private String message;

    @Value("${app.region:Singapore}")
    private String region;

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("OK", message, Instant.now(), region));
    }
}
