package com.agentflow.api.rest;

import com.agentflow.core.model.WorkflowType;
import com.agentflow.engine.health.EngineHealthIndicator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Liveness, readiness and service info for the deployment platform.
 * Readiness turns UP only once recovery has finished and the store answers.
 */
@RestController
public class HealthController {

    private final EngineHealthIndicator healthIndicator;
    private final String serviceName;
    private final String version;

    public HealthController(
            EngineHealthIndicator healthIndicator,
            @Value("${spring.application.name:agentflow}") String serviceName,
            @Value("${info.app.version:unknown}") String version) {
        this.healthIndicator = healthIndicator;
        this.serviceName = serviceName;
        this.version = version;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Health health = healthIndicator.health();
        HttpStatus status = Status.UP.equals(health.getStatus()) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(Map.of(
            "status", health.getStatus().getCode(),
            "details", health.getDetails()
        ));
    }

    @GetMapping("/health/ready")
    public ResponseEntity<Map<String, String>> ready() {
        if (healthIndicator.isReady()) {
            return ResponseEntity.ok(Map.of("status", Status.UP.getCode()));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("status", Status.OUT_OF_SERVICE.getCode()));
    }

    @GetMapping("/health/live")
    public ResponseEntity<Map<String, String>> live() {
        return ResponseEntity.ok(Map.of("status", Status.UP.getCode()));
    }

    @GetMapping("/info")
    public ResponseEntity<InfoResponse> info() {
        List<String> types = Arrays.stream(WorkflowType.values()).map(WorkflowType::value).toList();
        return ResponseEntity.ok(new InfoResponse(serviceName, version, types));
    }

    // ========== DTOs ==========

    public record InfoResponse(String service, String version, List<String> workflowTypes) {}
}
