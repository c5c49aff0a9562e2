package com.solarcharge.api.dto.request;

import com.solarcharge.domain.enums.ControlCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Start (ON) or stop (OFF) request for one port.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControlRequest {

    @NotNull
    private ControlCommand command;

    /** Authenticated caller; identity verification happens upstream. */
    @NotBlank
    private String userId;

    /** Optional on ON; defaults to the port's station. Ignored on OFF. */
    private String stationId;
}
