package com.susuchain.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Decoded result of a group's getGroupInfo().
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupInfo {

    private String name;
    private String ensName;
    private BigInteger contributionAmount;
    private BigInteger contributionInterval;
    private BigInteger maxMembers;
    private BigInteger currentMembers;
    private BigInteger currentRound;
    private boolean active;
    private String currentBeneficiary;
}
