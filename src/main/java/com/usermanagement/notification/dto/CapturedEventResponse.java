package com.usermanagement.notification.dto;

import com.usermanagement.notification.messaging.capture.CapturedEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapturedEventResponse {

    private String topic;
    private Map<String, Object> payload;
    private Instant capturedAt;

    public static CapturedEventResponse from(CapturedEvent event) {
        return CapturedEventResponse.builder()
                .topic(event.getTopic())
                .payload(event.getPayload())
                .capturedAt(event.getCapturedAt())
                .build();
    }
}
