package com.solarcharge.entity;

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** Composite key of current_device_status: (device_id, port_id). */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class CurrentDeviceStatusId implements Serializable {

    private String deviceId;
    private String portId;
}
