package com.example.documents.interfaces.api;

import com.example.documents.interfaces.api.dto.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Liveness probe used by the front end and by deployment scripts.
 */
@RestController
public class HealthController {

    private final Clock clock;

    public HealthController(Clock clock) {
        this.clock = clock;
    }

    @GetMapping("/api/health")
    public HealthResponse health() {
        return new HealthResponse("OK", clock.instant());
    }
}
