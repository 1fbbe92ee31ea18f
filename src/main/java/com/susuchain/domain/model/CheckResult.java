package com.susuchain.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer returned to the automation network for one checker invocation.
 *
 * execPayload (0x-prefixed hex) and execAddress are only meaningful when canExec is true.
 * The payload is the call data returned by the group's canExecutePayout(), unmodified.
 * Never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckResult {

    private boolean canExec;
    private String execAddress;
    private String execPayload;
    private String message;

    public static CheckResult skip(String message) {
        return CheckResult.builder()
                .canExec(false)
                .message(message)
                .build();
    }

    public static CheckResult execute(String execAddress, String execPayload, String message) {
        return CheckResult.builder()
                .canExec(true)
                .execAddress(execAddress)
                .execPayload(execPayload)
                .message(message)
                .build();
    }
}
