package com.susuchain.infrastructure.automation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A task as listed by the automation network.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutomationTask {

    private String taskId;
    private String name;
    private String execAddress;
    private String execSelector;
    private String resolverAddress;
    private String resolverData;
    private Instant lastExecuted;
    private Instant nextExecution;
}
