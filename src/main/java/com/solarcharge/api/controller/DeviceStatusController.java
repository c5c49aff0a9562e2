package com.solarcharge.api.controller;

import com.solarcharge.api.dto.response.ConsumptionPointResponse;
import com.solarcharge.api.dto.response.DeviceStatusResponse;
import com.solarcharge.service.SessionQueryService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * <ul>
 *   <li>GET /api/devices/status -- last reported status of every port</li>
 *   <li>GET /api/devices/{deviceId}/{portNumber}/consumption -- latest samples on a port</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/devices")
public class DeviceStatusController {

    private final SessionQueryService sessionQueryService;

    public DeviceStatusController(SessionQueryService sessionQueryService) {
        this.sessionQueryService = sessionQueryService;
    }

    @GetMapping("/status")
    public ResponseEntity<List<DeviceStatusResponse>> deviceStatuses() {
        return ResponseEntity.ok(sessionQueryService.deviceStatuses());
    }

    @GetMapping("/{deviceId}/{portNumber}/consumption")
    public ResponseEntity<List<ConsumptionPointResponse>> portConsumption(
            @PathVariable String deviceId, @PathVariable int portNumber) {
        return ResponseEntity.ok(sessionQueryService.portConsumption(deviceId, portNumber));
    }
}
