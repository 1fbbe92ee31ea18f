package com.susuchain.domain.service;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class AutomationCostEstimatorTest {

    private final AutomationCostEstimator estimator = new AutomationCostEstimator();

    @Test
    void estimateMonthlyCost_weeklyGroup() {
        // 30 days / 7 days = 4 executions
        assertEquals(new BigInteger("400000000000"), estimator.estimateMonthlyCost(7 * 24 * 60 * 60));
    }

    @Test
    void estimateMonthlyCost_dailyGroup() {
        assertEquals(new BigInteger("3000000000000"), estimator.estimateMonthlyCost(24 * 60 * 60));
    }

    @Test
    void estimateMonthlyCost_intervalLongerThanMonth_isZero() {
        assertEquals(BigInteger.ZERO, estimator.estimateMonthlyCost(60L * 24 * 60 * 60));
    }

    @Test
    void estimateMonthlyCost_nonPositiveInterval_rejected() {
        assertThrows(IllegalArgumentException.class, () -> estimator.estimateMonthlyCost(0));
    }
}
