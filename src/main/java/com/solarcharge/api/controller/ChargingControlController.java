package com.solarcharge.api.controller;

import com.solarcharge.api.dto.request.ControlRequest;
import com.solarcharge.api.dto.response.ControlResponse;
import com.solarcharge.domain.model.ControlResult;
import com.solarcharge.session.SessionControlService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Start/stop control for a single port.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/devices/{deviceId}/{portNumber}/control -- ON starts or resumes, OFF stops</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/devices")
public class ChargingControlController {

    private static final Logger log = LoggerFactory.getLogger(ChargingControlController.class);

    private final SessionControlService sessionControlService;

    public ChargingControlController(SessionControlService sessionControlService) {
        this.sessionControlService = sessionControlService;
    }

    @PostMapping("/{deviceId}/{portNumber}/control")
    public ResponseEntity<ControlResponse> control(
            @PathVariable String deviceId,
            @PathVariable int portNumber,
            @Valid @RequestBody ControlRequest request) {
        log.info(
                "Control request: deviceId={}, port={}, command={}, userId={}",
                deviceId,
                portNumber,
                request.getCommand(),
                request.getUserId());

        ControlResult result = sessionControlService.control(
                deviceId, portNumber, request.getCommand(), request.getUserId(), request.getStationId());

        return ResponseEntity.ok(ControlResponse.builder()
                .deviceId(result.getDeviceId())
                .portNumber(result.getPortNumber())
                .command(result.getCommand())
                .sessionId(result.getSessionId())
                .resumed(result.isResumed())
                .portStatus(result.getPortStatus())
                .commandPublished(result.isCommandPublished())
                .build());
    }
}
