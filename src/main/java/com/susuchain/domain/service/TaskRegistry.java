package com.susuchain.domain.service;

import com.susuchain.config.AutomationProperties;
import com.susuchain.domain.exception.DutyNotFoundException;
import com.susuchain.domain.exception.InvalidInputException;
import com.susuchain.domain.exception.QueryException;
import com.susuchain.domain.exception.RegistrationException;
import com.susuchain.domain.model.Addresses;
import com.susuchain.domain.model.DutyExecution;
import com.susuchain.domain.model.DutyRegistration;
import com.susuchain.domain.model.DutyState;
import com.susuchain.domain.model.ScheduledDuty;
import com.susuchain.infrastructure.automation.AutomationNetworkClient;
import com.susuchain.infrastructure.automation.AutomationNetworkException;
import com.susuchain.infrastructure.automation.AutomationTask;
import com.susuchain.infrastructure.automation.CreateTaskRequest;
import com.susuchain.infrastructure.chain.SusuGroupAbi;
import com.susuchain.infrastructure.persistence.entity.ScheduledDutyEntity;
import com.susuchain.infrastructure.persistence.repository.ScheduledDutyRepository;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Owns the payout duties registered with the automation network.
 *
 * Registration is idempotent: a group with an active duty, or one the network
 * reports as duplicate, yields ALREADY_EXISTS and never a second duty.
 *
 * Every network call runs on the automation executor under a Resilience4j
 * TimeLimiter. A create or cancel that times out may still have been applied; it
 * is reported with outcomeUnknown so the caller re-queries listDuties instead of
 * trusting it. The caller's timeout covers the duplicate check and the create together.
 *
 * Creates for the same group are serialised within this instance. Across instances
 * the check-then-create is not atomic and a second duty is only prevented by the
 * network answering DUPLICATE_TASK.
 *
 * No retries here; retry policy belongs to the caller.
 */
@Slf4j
@Service
public class TaskRegistry {

    private final AutomationNetworkClient networkClient;
    private final ScheduledDutyRepository dutyRepository;
    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final AutomationProperties properties;
    private final ConcurrentMap<String, Object> groupLocks = new ConcurrentHashMap<>();

    public TaskRegistry(AutomationNetworkClient networkClient,
                        ScheduledDutyRepository dutyRepository,
                        @Qualifier("automationTaskExecutor") Executor executor,
                        MeterRegistry meterRegistry,
                        AutomationProperties properties) {
        this.networkClient = networkClient;
        this.dutyRepository = dutyRepository;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
    }

    public DutyRegistration createDuty(String groupAddress, String groupName) {
        return createDuty(groupAddress, groupName, properties.getAutomation().getRequestTimeout());
    }

    /**
     * Registers the payout duty for a group unless it already has one.
     *
     * @throws RegistrationException if the network rejects or cannot be reached
     */
    public DutyRegistration createDuty(String groupAddress, String groupName, Duration timeout) {
        requireAddress(groupAddress);
        if (groupName == null || groupName.isBlank()) {
            throw new InvalidInputException("Missing group name for " + groupAddress);
        }

        synchronized (groupLocks.computeIfAbsent(groupAddress.toLowerCase(), key -> new Object())) {
            return registerDuty(groupAddress, dutyName(groupName), timeout);
        }
    }

    private DutyRegistration registerDuty(String groupAddress, String name, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();

        Optional<ScheduledDuty> existing;
        try {
            existing = listDuties(groupAddress, timeout).stream()
                    .filter(ScheduledDuty::isActive)
                    .findFirst();
        } catch (QueryException e) {
            recordRegistration("failed");
            throw new RegistrationException("Failed to check existing duties for " + groupAddress + ": "
                    + e.getMessage(), groupAddress, e);
        }
        if (existing.isPresent()) {
            log.info("Duty already exists for group {}: {}", groupAddress, existing.get().getDutyId());
            recordRegistration("already_exists");
            return alreadyExists(groupAddress, existing.get().getDutyId(), name);
        }

        Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
        if (remaining.isNegative() || remaining.isZero()) {
            recordRegistration("timeout");
            throw new RegistrationException("Timed out after " + timeout + " before creating duty for "
                    + groupAddress, groupAddress, null);
        }

        CreateTaskRequest request = CreateTaskRequest.builder()
                .execAddress(groupAddress)
                .execSelector(SusuGroupAbi.DUTY_EXECUTE.getSelector())
                .dedicatedMsgSender(true)
                .name(name)
                .resolverAddress(groupAddress)
                .resolverData(SusuGroupAbi.DUTY_RESOLVER.getSelector())
                .build();

        String dutyId;
        try {
            dutyId = callWithTimeout(() -> networkClient.createTask(request), remaining);
        } catch (AutomationNetworkException e) {
            if (e.getErrorCode() == AutomationNetworkException.ErrorCode.DUPLICATE_TASK) {
                log.info("Automation network reports duty already exists for group {}", groupAddress);
                recordRegistration("already_exists");
                return alreadyExists(groupAddress, null, name);
            }
            recordRegistration("failed");
            throw new RegistrationException("Failed to create duty for " + groupAddress + ": " + e.getMessage(),
                    groupAddress, e.getErrorCode() == AutomationNetworkException.ErrorCode.UNAVAILABLE, e);
        } catch (TimeoutException e) {
            recordRegistration("timeout");
            throw new RegistrationException("Timed out after " + timeout + " creating duty for " + groupAddress,
                    groupAddress, true, e);
        }

        dutyRepository.save(ScheduledDutyEntity.builder()
                .dutyId(dutyId)
                .groupAddress(groupAddress)
                .name(name)
                .execSelector(request.getExecSelector())
                .resolverSelector(request.getResolverData())
                .active(true)
                .build());

        log.info("Created duty {} for group {} ({})", dutyId, groupAddress, name);
        recordRegistration("created");

        return DutyRegistration.builder()
                .dutyId(dutyId)
                .groupAddress(groupAddress)
                .name(name)
                .status(DutyRegistration.Status.CREATED)
                .build();
    }

    public void cancelDuty(String dutyId) {
        cancelDuty(dutyId, properties.getAutomation().getRequestTimeout());
    }

    /**
     * @throws DutyNotFoundException if the network does not know the duty
     * @throws RegistrationException on any other failure
     */
    public void cancelDuty(String dutyId, Duration timeout) {
        requireDutyId(dutyId);

        try {
            callWithTimeout(() -> {
                networkClient.cancelTask(dutyId);
                return null;
            }, timeout);
        } catch (AutomationNetworkException e) {
            if (e.getErrorCode() == AutomationNetworkException.ErrorCode.TASK_NOT_FOUND) {
                throw new DutyNotFoundException(dutyId, e);
            }
            throw new RegistrationException("Failed to cancel duty " + dutyId + ": " + e.getMessage(),
                    dutyId, e.getErrorCode() == AutomationNetworkException.ErrorCode.UNAVAILABLE, e);
        } catch (TimeoutException e) {
            throw new RegistrationException("Timed out after " + timeout + " cancelling duty " + dutyId,
                    dutyId, true, e);
        }

        dutyRepository.findById(dutyId).ifPresent(entity -> {
            entity.deactivate();
            dutyRepository.save(entity);
        });

        log.info("Cancelled duty {}", dutyId);
    }

    /**
     * Duties whose exec address is the group, from the network's active task list.
     *
     * @throws QueryException if the network cannot be queried
     */
    public List<ScheduledDuty> listDuties(String groupAddress) {
        requireAddress(groupAddress);
        return listDuties(groupAddress, properties.getAutomation().getRequestTimeout());
    }

    private List<ScheduledDuty> listDuties(String groupAddress, Duration timeout) {
        List<AutomationTask> tasks = query("list active duties", networkClient::getActiveTasks, timeout);

        return tasks.stream()
                .filter(task -> Addresses.same(task.getExecAddress(), groupAddress))
                .map(this::toDuty)
                .collect(Collectors.toList());
    }

    public boolean hasActiveDuty(String groupAddress) {
        return listDuties(groupAddress).stream().anyMatch(ScheduledDuty::isActive);
    }

    /**
     * Last/next execution as reported by the network. Advisory only.
     */
    public DutyState getDutyState(String dutyId) {
        requireDutyId(dutyId);

        DutyState state = queryDuty(dutyId, () -> networkClient.getTaskState(dutyId));

        dutyRepository.findById(dutyId).ifPresent(entity -> {
            entity.setLastExecuted(state.getLastExecuted());
            entity.setNextExecution(state.getNextExecution());
            dutyRepository.save(entity);
        });
        return state;
    }

    public List<DutyExecution> getDutyExecutions(String dutyId) {
        requireDutyId(dutyId);
        return queryDuty(dutyId, () -> networkClient.getTaskExecutions(dutyId));
    }

    public BigInteger getBalance() {
        return query("read automation balance", networkClient::getBalance);
    }

    public void depositFunds(BigInteger amountWei) {
        if (amountWei == null || amountWei.signum() <= 0) {
            throw new InvalidInputException("Deposit amount must be positive");
        }
        try {
            networkClient.depositFunds(amountWei);
        } catch (AutomationNetworkException e) {
            throw new RegistrationException("Failed to deposit " + amountWei + " wei: " + e.getMessage(),
                    "balance", e.getErrorCode() == AutomationNetworkException.ErrorCode.UNAVAILABLE, e);
        }
        log.info("Deposited {} wei to automation balance", amountWei);
    }

    public String dutyName(String groupName) {
        return properties.getProductName() + " Payout - " + groupName;
    }

    private ScheduledDuty toDuty(AutomationTask task) {
        return ScheduledDuty.builder()
                .dutyId(task.getTaskId())
                .groupAddress(task.getExecAddress())
                .name(task.getName() != null ? task.getName() : "Task " + shortId(task.getTaskId()))
                .execSelector(task.getExecSelector())
                .resolverSelector(task.getResolverData())
                .active(true)
                .lastExecuted(task.getLastExecuted())
                .nextExecution(task.getNextExecution())
                .build();
    }

    private DutyRegistration alreadyExists(String groupAddress, String dutyId, String name) {
        return DutyRegistration.builder()
                .dutyId(dutyId)
                .groupAddress(groupAddress)
                .name(name)
                .status(DutyRegistration.Status.ALREADY_EXISTS)
                .build();
    }

    private <T> T callWithTimeout(Supplier<T> call, Duration timeout) throws TimeoutException {
        TimeLimiter timeLimiter = TimeLimiter.of("automationNetwork", TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
        try {
            return timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, executor));
        } catch (TimeoutException | AutomationNetworkException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AutomationNetworkException(AutomationNetworkException.ErrorCode.UNAVAILABLE,
                    "Interrupted waiting for the automation network", e);
        } catch (Exception e) {
            throw new AutomationNetworkException(AutomationNetworkException.ErrorCode.UNAVAILABLE,
                    String.valueOf(e.getMessage()), e);
        }
    }

    private <T> T query(String operation, Supplier<T> call) {
        return query(operation, call, properties.getAutomation().getRequestTimeout());
    }

    private <T> T query(String operation, Supplier<T> call, Duration timeout) {
        try {
            return callWithTimeout(call, timeout);
        } catch (AutomationNetworkException e) {
            throw new QueryException("Failed to " + operation + ": " + e.getMessage(), e);
        } catch (TimeoutException e) {
            throw new QueryException("Timed out trying to " + operation, e);
        }
    }

    private <T> T queryDuty(String dutyId, Supplier<T> call) {
        try {
            return query("query duty " + dutyId, call);
        } catch (QueryException e) {
            if (e.getCause() instanceof AutomationNetworkException
                    && ((AutomationNetworkException) e.getCause()).getErrorCode()
                    == AutomationNetworkException.ErrorCode.TASK_NOT_FOUND) {
                throw new DutyNotFoundException(dutyId, e.getCause());
            }
            throw e;
        }
    }

    private void recordRegistration(String result) {
        Counter.builder("automation.duty.registration")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private static void requireAddress(String groupAddress) {
        if (!Addresses.isValid(groupAddress)) {
            throw new InvalidInputException("Invalid group address: " + groupAddress);
        }
    }

    private static void requireDutyId(String dutyId) {
        if (dutyId == null || dutyId.isBlank()) {
            throw new InvalidInputException("Missing duty id");
        }
    }

    private static String shortId(String taskId) {
        return taskId == null ? "?" : taskId.substring(0, Math.min(8, taskId.length()));
    }
}
