package com.susuchain.domain.service;

import com.susuchain.config.AutomationProperties;
import com.susuchain.domain.exception.QueryException;
import com.susuchain.domain.exception.RegistrationException;
import com.susuchain.domain.model.Addresses;
import com.susuchain.domain.model.BootstrapReport;
import com.susuchain.domain.model.BootstrapReport.GroupOutcome;
import com.susuchain.domain.model.BootstrapReport.Outcome;
import com.susuchain.domain.model.DutyRegistration;
import com.susuchain.domain.model.GroupInfo;
import com.susuchain.infrastructure.chain.SusuFactoryReader;
import com.susuchain.infrastructure.chain.SusuGroupReader;
import com.susuchain.infrastructure.chain.SusuGroupWriter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;

/**
 * One-shot reconciliation wiring automation for every group the factory knows.
 *
 * Per group:
 * 1. Read group info; inactive groups are skipped before any write
 * 2. Set the automation executor if unset (one on-chain write)
 * 3. Register the payout duty; an existing duty counts as success
 *
 * One group's failure is reported and the run moves on. Nothing is retried.
 * A registration that timed out is settled by re-querying the registry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BootstrapOrchestrator {

    private final SusuFactoryReader factoryReader;
    private final SusuGroupReader groupReader;
    private final SusuGroupWriter groupWriter;
    private final TaskRegistry taskRegistry;
    private final MeterRegistry meterRegistry;
    private final AutomationProperties properties;
    private final Clock clock;

    /**
     * @throws com.susuchain.domain.exception.ChainReadException if the factory cannot be enumerated
     */
    public BootstrapReport run() {
        BootstrapReport report = BootstrapReport.builder()
                .startedAt(clock.instant())
                .build();

        checkBalance();

        List<String> groups = enumerateGroups();
        log.info("Bootstrapping automation for {} groups", groups.size());

        for (String groupAddress : groups) {
            GroupOutcome outcome = processGroup(groupAddress);
            report.getGroups().add(outcome);

            Counter.builder("bootstrap.group")
                    .tag("outcome", outcome.getOutcome().name().toLowerCase())
                    .register(meterRegistry)
                    .increment();
        }

        report.setFinishedAt(clock.instant());
        log.info("Bootstrap complete: created={}, alreadyWired={}, skipped={}, failed={}",
                report.count(Outcome.DUTY_CREATED), report.count(Outcome.ALREADY_WIRED),
                report.count(Outcome.SKIPPED_INACTIVE), report.count(Outcome.FAILED));
        return report;
    }

    private GroupOutcome processGroup(String groupAddress) {
        GroupOutcome.GroupOutcomeBuilder outcome = GroupOutcome.builder().groupAddress(groupAddress);

        try {
            GroupInfo info = groupReader.getGroupInfo(groupAddress);
            outcome.groupName(info.getName());

            if (!info.isActive()) {
                log.info("Skipping inactive group {} ({})", groupAddress, info.getName());
                return outcome.outcome(Outcome.SKIPPED_INACTIVE).message("Group is not active").build();
            }

            outcome.executorSet(ensureExecutor(groupAddress));

            try {
                DutyRegistration registration = taskRegistry.createDuty(groupAddress, info.getName());
                outcome.dutyId(registration.getDutyId());

                if (registration.isNewlyCreated()) {
                    return outcome.outcome(Outcome.DUTY_CREATED).build();
                }
                log.info("Duty already exists for group {}", groupAddress);
                return outcome.outcome(Outcome.ALREADY_WIRED).message("Duty already exists").build();

            } catch (RegistrationException e) {
                if (e.isOutcomeUnknown() && confirmActiveDuty(groupAddress)) {
                    log.info("Duty for group {} confirmed after ambiguous failure: {}", groupAddress, e.getMessage());
                    return outcome.outcome(Outcome.ALREADY_WIRED)
                            .message("Duty confirmed after ambiguous failure")
                            .build();
                }
                throw e;
            }

        } catch (Exception e) {
            log.error("Error setting up automation for group {}: {}", groupAddress, e.getMessage(), e);
            return outcome.outcome(Outcome.FAILED).message(e.getMessage()).build();
        }
    }

    private boolean ensureExecutor(String groupAddress) {
        String currentExecutor = groupReader.getAutomationExecutor(groupAddress);

        if (!Addresses.isZero(currentExecutor)) {
            log.debug("Automation executor already set for group {}: {}", groupAddress, currentExecutor);
            return false;
        }

        String executor = properties.getAutomation().getExecutorAddress();
        String transactionHash = groupWriter.setAutomationExecutor(groupAddress, executor);
        log.info("Automation executor set for group {} to {} (tx={})", groupAddress, executor, transactionHash);
        return true;
    }

    private boolean confirmActiveDuty(String groupAddress) {
        try {
            return taskRegistry.hasActiveDuty(groupAddress);
        } catch (QueryException e) {
            log.warn("Could not confirm duty for group {}: {}", groupAddress, e.getMessage());
            return false;
        }
    }

    private List<String> enumerateGroups() {
        int limit = properties.getBootstrap().getRecentGroupLimit();
        return limit > 0 ? factoryReader.getRecentGroups(limit) : factoryReader.getAllGroups();
    }

    private void checkBalance() {
        try {
            BigInteger balance = taskRegistry.getBalance();
            BigInteger threshold = properties.getBootstrap().getLowBalanceThresholdWei();

            log.info("Automation balance: {} wei", balance);
            if (balance.compareTo(threshold) < 0) {
                log.warn("Low automation balance ({} wei < {} wei); fund it before payouts are due",
                        balance, threshold);
            }
        } catch (QueryException e) {
            log.warn("Could not fetch automation balance: {}", e.getMessage());
        }
    }
}
