package com.susuchain.domain.service;

import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Rough monthly cost of a payout duty on Base: ~100k gas per execution at 0.001 gwei.
 */
@Component
public class AutomationCostEstimator {

    static final BigInteger GAS_PER_EXECUTION = BigInteger.valueOf(100_000);
    static final BigInteger GAS_PRICE_WEI = BigInteger.valueOf(1_000_000);
    static final long SECONDS_PER_MONTH = 30L * 24 * 60 * 60;

    /**
     * @param contributionIntervalSeconds round length of the group
     * @return estimated wei spent per 30 days
     */
    public BigInteger estimateMonthlyCost(long contributionIntervalSeconds) {
        if (contributionIntervalSeconds <= 0) {
            throw new IllegalArgumentException("Contribution interval must be positive");
        }
        BigInteger executionsPerMonth = BigInteger.valueOf(SECONDS_PER_MONTH / contributionIntervalSeconds);
        return GAS_PER_EXECUTION.multiply(GAS_PRICE_WEI).multiply(executionsPerMonth);
    }
}
