package com.solarcharge.api.controller;

import com.solarcharge.api.dto.response.HealthResponse;
import com.solarcharge.session.ChargingCoordinator;
import com.solarcharge.transport.ControlCommandSender;
import java.time.Instant;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Shallow health check. Always 200 while the application responds; transport state is
 * reported, not checked.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final ChargingCoordinator chargingCoordinator;
    private final ControlCommandSender controlCommandSender;

    public HealthController(ChargingCoordinator chargingCoordinator, ControlCommandSender controlCommandSender) {
        this.chargingCoordinator = chargingCoordinator;
        this.controlCommandSender = controlCommandSender;
    }

    @GetMapping
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.builder()
                .status("OK")
                .timestamp(Instant.now())
                .trackedSessions(chargingCoordinator.trackedCount())
                .armedTimers(chargingCoordinator.armedCount())
                .mqttConnected(controlCommandSender.isTransportConnected())
                .build());
    }
}
