package com.solarcharge.observability;

import com.solarcharge.event.ChargingSessionEvent;
import com.solarcharge.event.ChargingSessionEventType;
import com.solarcharge.event.ControlCommandEvent;
import com.solarcharge.event.StaleSweepEvent;
import com.solarcharge.event.TelemetryEvent;
import com.solarcharge.event.TelemetryEventType;
import com.solarcharge.session.ChargingCoordinator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Coordinator metrics:
 * <ul>
 *   <li><b>telemetry.usage.accepted</b>, <b>telemetry.dropped</b> (counters)</li>
 *   <li><b>sessions.started</b>, <b>sessions.completed</b> tagged by close reason (counters)</li>
 *   <li><b>control.publish.failed</b>, <b>reconciler.stale.completed</b> (counters)</li>
 *   <li><b>sessions.tracked</b>, <b>timers.armed</b> (gauges over the coordinator)</li>
 * </ul>
 * Counters are driven by application events, gauges are polled on scrape.
 */
@Service
public class CoordinatorMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter usageAcceptedCounter;
    private final Counter telemetryDroppedCounter;
    private final Counter sessionsStartedCounter;
    private final Counter publishFailedCounter;
    private final Counter staleCompletedCounter;

    public CoordinatorMetricsService(MeterRegistry meterRegistry, ChargingCoordinator chargingCoordinator) {
        this.meterRegistry = meterRegistry;

        this.usageAcceptedCounter = Counter.builder("telemetry.usage.accepted")
                .description("Positive usage samples accounted to a session")
                .register(meterRegistry);

        this.telemetryDroppedCounter = Counter.builder("telemetry.dropped")
                .description("Inbound telemetry messages dropped")
                .register(meterRegistry);

        this.sessionsStartedCounter = Counter.builder("sessions.started")
                .description("Charging sessions created")
                .register(meterRegistry);

        this.publishFailedCounter = Counter.builder("control.publish.failed")
                .description("Control commands the transport did not accept")
                .register(meterRegistry);

        this.staleCompletedCounter = Counter.builder("reconciler.stale.completed")
                .description("Sessions force-completed by the stale session sweep")
                .register(meterRegistry);

        meterRegistry.gauge("sessions.tracked", chargingCoordinator, ChargingCoordinator::trackedCount);
        meterRegistry.gauge("timers.armed", chargingCoordinator, ChargingCoordinator::armedCount);
    }

    @EventListener
    public void onSessionEvent(ChargingSessionEvent event) {
        if (event.getEventType() == ChargingSessionEventType.STARTED) {
            sessionsStartedCounter.increment();
        } else if (event.isCompletion()) {
            Counter.builder("sessions.completed")
                    .description("Charging sessions completed, by close reason")
                    .tag("reason", event.getReason().name())
                    .register(meterRegistry)
                    .increment();
        }
    }

    @EventListener
    public void onTelemetryEvent(TelemetryEvent event) {
        if (event.getEventType() == TelemetryEventType.ACCEPTED) {
            usageAcceptedCounter.increment();
        } else if (event.getEventType() == TelemetryEventType.DROPPED) {
            telemetryDroppedCounter.increment();
        }
    }

    @EventListener
    public void onControlCommand(ControlCommandEvent event) {
        if (!event.isPublished()) {
            publishFailedCounter.increment();
        }
    }

    @EventListener
    public void onStaleSweep(StaleSweepEvent event) {
        staleCompletedCounter.increment(event.getResult().getCompleted());
    }
}
