package com.phillippitts.groundstation.presentation.controller;

import com.phillippitts.groundstation.config.properties.SatelliteProperties;
import com.phillippitts.groundstation.service.session.SessionRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness and readiness probes used by load balancers and satellites.
 */
@RestController
class StatusController {

    private final SessionRegistry registry;
    private final SatelliteProperties properties;

    StatusController(SessionRegistry registry, SatelliteProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    /**
     * Reports current load. The connection limit is informational; it is not enforced here.
     */
    @GetMapping("/acceptsConnections")
    ResponseEntity<Map<String, Object>> acceptsConnections() {
        return ResponseEntity.ok(Map.of(
                "status", "ready",
                "active_connections", registry.activeSessionCount(),
                "max_connections", properties.getMaxConnections()
        ));
    }
}
