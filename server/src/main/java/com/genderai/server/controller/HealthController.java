package com.genderai.server.controller;

import com.genderai.server.service.PredictionOrchestrator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    static final String VERSION = "1.0.0";

    private final PredictionOrchestrator orchestrator;
    private final Clock clock;

    public HealthController(PredictionOrchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("message", "Gender Classification API");
        body.put("status", "healthy");
        body.put("version", VERSION);
        return body;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return HealthResponse.from(orchestrator.health(), clock.instant());
    }
}
