package com.solarcharge.exception;

import java.util.Map;

/** The port already carries an ACTIVE session owned by another user. */
public class PortOccupiedException extends BaseException {

    public PortOccupiedException(String portId) {
        super(ErrorCode.PORT_OCCUPIED, "Port " + portId + " is occupied by another user", Map.of("portId", portId));
    }
}
