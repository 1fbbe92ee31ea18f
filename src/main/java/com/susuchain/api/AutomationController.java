package com.susuchain.api;

import com.susuchain.domain.model.BootstrapReport;
import com.susuchain.domain.model.CheckResult;
import com.susuchain.domain.model.DutyExecution;
import com.susuchain.domain.model.DutyRegistration;
import com.susuchain.domain.model.DutyState;
import com.susuchain.domain.model.ScheduledDuty;
import com.susuchain.domain.service.AutomationCostEstimator;
import com.susuchain.domain.service.BootstrapOrchestrator;
import com.susuchain.domain.service.PayoutChecker;
import com.susuchain.domain.service.TaskRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * REST API for payout automation.
 *
 * The payout-check endpoint is the resolver the automation network polls;
 * the rest is for operators and the web client.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AutomationController {

    private final PayoutChecker payoutChecker;
    private final TaskRegistry taskRegistry;
    private final BootstrapOrchestrator bootstrapOrchestrator;
    private final AutomationCostEstimator costEstimator;

    /**
     * GET /api/v1/groups/{groupAddress}/payout-check
     *
     * Always 200 for a well-formed address; failures are reported in the result.
     */
    @GetMapping("/groups/{groupAddress}/payout-check")
    public ResponseEntity<CheckResult> checkPayout(@PathVariable String groupAddress) {
        return ResponseEntity.ok(payoutChecker.check(groupAddress));
    }

    @GetMapping("/groups/{groupAddress}/duties")
    public ResponseEntity<List<ScheduledDuty>> listDuties(@PathVariable String groupAddress) {
        return ResponseEntity.ok(taskRegistry.listDuties(groupAddress));
    }

    @GetMapping("/groups/{groupAddress}/duties/active")
    public ResponseEntity<Map<String, Boolean>> hasActiveDuty(@PathVariable String groupAddress) {
        return ResponseEntity.ok(Map.of("active", taskRegistry.hasActiveDuty(groupAddress)));
    }

    /**
     * POST /api/v1/groups/{groupAddress}/duties
     *
     * 201 when a duty was created, 200 when the group already had one.
     */
    @PostMapping("/groups/{groupAddress}/duties")
    public ResponseEntity<DutyRegistration> createDuty(@PathVariable String groupAddress,
                                                       @Valid @RequestBody CreateDutyRequest request) {
        log.info("Received duty request for group: {}", groupAddress);

        DutyRegistration registration = taskRegistry.createDuty(groupAddress, request.getGroupName());
        HttpStatus status = registration.isNewlyCreated() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(registration);
    }

    @DeleteMapping("/duties/{dutyId}")
    public ResponseEntity<Void> cancelDuty(@PathVariable String dutyId) {
        log.info("Received cancel request for duty: {}", dutyId);

        taskRegistry.cancelDuty(dutyId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/duties/{dutyId}/state")
    public ResponseEntity<DutyState> getDutyState(@PathVariable String dutyId) {
        return ResponseEntity.ok(taskRegistry.getDutyState(dutyId));
    }

    @GetMapping("/duties/{dutyId}/executions")
    public ResponseEntity<List<DutyExecution>> getDutyExecutions(@PathVariable String dutyId) {
        return ResponseEntity.ok(taskRegistry.getDutyExecutions(dutyId));
    }

    @GetMapping("/automation/balance")
    public ResponseEntity<Map<String, BigInteger>> getBalance() {
        return ResponseEntity.ok(Map.of("balanceWei", taskRegistry.getBalance()));
    }

    @PostMapping("/automation/balance/deposits")
    public ResponseEntity<Void> deposit(@Valid @RequestBody DepositRequest request) {
        taskRegistry.depositFunds(request.getAmountWei());
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/automation/cost-estimate")
    public ResponseEntity<Map<String, BigInteger>> estimateCost(@RequestParam long contributionIntervalSeconds) {
        return ResponseEntity.ok(Map.of("monthlyCostWei",
                costEstimator.estimateMonthlyCost(contributionIntervalSeconds)));
    }

    @PostMapping("/bootstrap")
    public ResponseEntity<BootstrapReport> bootstrap() {
        log.info("Received bootstrap request");
        return ResponseEntity.ok(bootstrapOrchestrator.run());
    }
}
