package com.susuchain.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Member-initiated change to a group's automation, published by the web client.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutomationRequest {

    private UUID requestId;
    private RequestType type;
    private String groupAddress;
    private String groupName;
    private String dutyId;
    private Instant timestamp;

    public enum RequestType {
        OPT_IN,
        OPT_OUT
    }
}
