package com.susuchain.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Decoded return of a group's canExecutePayout(): (bool canExec, bytes execPayload).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PayoutEligibility {

    private boolean canExec;
    private byte[] execPayload;
}
