package com.solarcharge.event;

import com.solarcharge.domain.model.StaleSweepResult;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/** Published after each stale-session sweep that found at least one stale session. */
@Getter
public class StaleSweepEvent extends ApplicationEvent {

    private final StaleSweepResult result;

    public StaleSweepEvent(Object source, StaleSweepResult result) {
        super(source);
        this.result = result;
    }
}
