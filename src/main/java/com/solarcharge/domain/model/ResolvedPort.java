package com.solarcharge.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of resolving a (device, physical index) pair through the port directory.
 */
@Value
@Builder
public class ResolvedPort {

    String portId;
    String stationId;
    String deviceId;
    int deviceIndex;
    boolean premium;
}
