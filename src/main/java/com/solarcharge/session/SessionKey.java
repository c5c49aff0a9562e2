package com.solarcharge.session;

import lombok.Value;

/**
 * In-process address of a port: (device id, physical index). Distinct from the durable
 * port id, which requires a directory lookup.
 */
@Value(staticConstructor = "of")
public class SessionKey {

    String deviceId;
    int portIndex;

    @Override
    public String toString() {
        return deviceId + "_" + portIndex;
    }
}
