package com.susuchain.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Diagnostic view of a duty as reported by the automation network. Advisory only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DutyState {

    private String dutyId;
    private String status;
    private Instant lastExecuted;
    private Instant nextExecution;
}
