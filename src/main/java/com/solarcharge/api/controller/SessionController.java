package com.solarcharge.api.controller;

import com.solarcharge.api.dto.response.ActiveSessionResponse;
import com.solarcharge.api.dto.response.SessionConsumptionResponse;
import com.solarcharge.domain.model.StaleSweepResult;
import com.solarcharge.reconciliation.StaleSessionReconciler;
import com.solarcharge.service.SessionQueryService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session read endpoints and the manual stale-session sweep.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/sessions/active -- all ACTIVE sessions</li>
 *   <li>GET /api/sessions/{sessionId}/consumption -- summary and sample series</li>
 *   <li>POST /api/sessions/reconcile -- run a stale-session sweep now</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionQueryService sessionQueryService;
    private final StaleSessionReconciler staleSessionReconciler;

    public SessionController(SessionQueryService sessionQueryService, StaleSessionReconciler staleSessionReconciler) {
        this.sessionQueryService = sessionQueryService;
        this.staleSessionReconciler = staleSessionReconciler;
    }

    @GetMapping("/active")
    public ResponseEntity<List<ActiveSessionResponse>> activeSessions() {
        return ResponseEntity.ok(sessionQueryService.activeSessions());
    }

    @GetMapping("/{sessionId}/consumption")
    public ResponseEntity<SessionConsumptionResponse> sessionConsumption(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionQueryService.sessionConsumption(sessionId));
    }

    @PostMapping("/reconcile")
    public ResponseEntity<StaleSweepResult> reconcile() {
        log.info("Manual stale-session sweep requested");
        return ResponseEntity.ok(staleSessionReconciler.manualSweep());
    }
}
