package com.usermanagement.notification.task;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResult {

    public static final String SUCCESS = "success";

    private String status;

    private String message;

    /**
     * Message-ID of the email that was sent.
     */
    private String providerId;

    public static ExecutionResult success(String message, String providerId) {
        return ExecutionResult.builder()
                .status(SUCCESS)
                .message(message)
                .providerId(providerId)
                .build();
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
