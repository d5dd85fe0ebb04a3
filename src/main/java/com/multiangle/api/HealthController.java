package com.multiangle.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    static final String SERVICE_NAME = "Multi-Angle Query Orchestrator";
    static final String VERSION = "1.0.0";

    @GetMapping({"/api/health", "/health"})
    public HealthResponse health() {
        return new HealthResponse("healthy", SERVICE_NAME, VERSION);
    }

    public record HealthResponse(String status, String service, String version) {
    }
}
