package com.usermanagement.notification.dto;

import com.usermanagement.notification.messaging.availability.AvailabilityGate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityResponse {

    private boolean forcedUnavailable;
    private boolean testMode;
    private boolean bypassActive;
    private boolean producerDegraded;
    private int capturedCount;

    public static AvailabilityResponse of(AvailabilityGate gate, boolean producerDegraded, int capturedCount) {
        return AvailabilityResponse.builder()
                .forcedUnavailable(gate.isForcedUnavailable())
                .testMode(gate.isTestModeActive())
                .bypassActive(gate.isBypassActive())
                .producerDegraded(producerDegraded)
                .capturedCount(capturedCount)
                .build();
    }
}
