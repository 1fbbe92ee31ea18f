package com.susuchain.domain.service;

import com.susuchain.domain.model.Addresses;
import com.susuchain.domain.model.CheckResult;
import com.susuchain.domain.model.PayoutEligibility;
import com.susuchain.infrastructure.chain.AbiCodec;
import com.susuchain.infrastructure.chain.SusuGroupReader;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Resolver polled by the automation network for each group's duty.
 *
 * Evaluation:
 * 1. Group inactive: stop, nothing to execute
 * 2. Contract's canExecutePayout() false: report round and time remaining
 * 3. Otherwise: hand back the contract's exec payload unmodified
 *
 * Read-only and safe to call concurrently. Once a payout executes, the contract's
 * canExecutePayout() turns false for that round, so repeated or overlapping
 * checks converge without coordination here.
 *
 * Failure Handling:
 * - Missing or malformed group address: negative result, no chain reads
 * - Chain read fails (RPC error, revert, bad encoding): negative result with the error text
 * - No retries: the automation network polls again on its own cadence
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayoutChecker {

    private final SusuGroupReader groupReader;
    private final MeterRegistry meterRegistry;

    /**
     * Never throws; every failure comes back as a result with canExec false.
     */
    public CheckResult check(String groupAddress) {
        if (groupAddress == null || groupAddress.isBlank()) {
            record("invalid");
            return CheckResult.skip("Missing group address");
        }
        if (!Addresses.isValid(groupAddress)) {
            record("invalid");
            return CheckResult.skip("Invalid group address: " + groupAddress);
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        CheckResult result = evaluate(groupAddress);
        sample.stop(Timer.builder("payout.check.latency").register(meterRegistry));

        return result;
    }

    private CheckResult evaluate(String groupAddress) {
        try {
            if (!groupReader.isGroupActive(groupAddress)) {
                record("inactive");
                return CheckResult.skip("Group " + groupAddress + " is no longer active");
            }

            PayoutEligibility eligibility = groupReader.canExecutePayout(groupAddress);

            if (!eligibility.isCanExec()) {
                BigInteger currentRound = groupReader.getCurrentRound(groupAddress);
                BigInteger timeRemaining = groupReader.getTimeUntilDeadline(groupAddress);

                record("waiting");
                return CheckResult.skip(String.format("Waiting for round %s. Time until deadline: %ss",
                        currentRound, timeRemaining));
            }

            BigInteger currentRound = groupReader.getCurrentRound(groupAddress);
            String message = String.format("Executing payout for round %s of group %s", currentRound, groupAddress);

            log.info(message);
            record("executable");
            return CheckResult.execute(groupAddress, AbiCodec.toHex(eligibility.getExecPayload()), message);

        } catch (Exception e) {
            log.warn("Payout check failed for group {}: {}", groupAddress, e.getMessage());
            record("error");
            return CheckResult.skip("Error checking payout: " + e.getMessage());
        }
    }

    private void record(String result) {
        Counter.builder("payout.check")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
