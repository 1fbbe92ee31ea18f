package com.susuchain.domain.service;

import com.susuchain.config.AutomationProperties;
import com.susuchain.domain.model.DeadlineSnapshot;
import com.susuchain.domain.model.GroupInfo;
import com.susuchain.infrastructure.chain.SusuGroupReader;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Polls round deadlines of watched groups and feeds them to the notifier.
 *
 * Chain reads for all groups run in parallel under one TimeLimiter deadline of
 * app.notifications.group-read-timeout per tick. Groups not read by then are
 * skipped for this tick, so slow groups never hold up the others. Ticks are then
 * evaluated on the polling thread in group order; with fixed-delay scheduling a
 * group's ticks never overlap.
 */
@Slf4j
@Component
public class DeadlinePoller {

    private final SusuGroupReader groupReader;
    private final DeadlineNotifier notifier;
    private final Executor executor;
    private final AutomationProperties properties;
    private final Clock clock;

    public DeadlinePoller(SusuGroupReader groupReader,
                          DeadlineNotifier notifier,
                          @Qualifier("automationTaskExecutor") Executor executor,
                          AutomationProperties properties,
                          Clock clock) {
        this.groupReader = groupReader;
        this.notifier = notifier;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.notifications.polling-interval:PT1M}")
    public void poll() {
        List<String> groups = properties.getNotifications().getWatchedGroups();
        if (groups.isEmpty()) {
            return;
        }

        Map<String, CompletableFuture<Optional<DeadlineSnapshot>>> reads = new LinkedHashMap<>();
        for (String groupAddress : groups) {
            reads.put(groupAddress, CompletableFuture
                    .supplyAsync(() -> readSnapshot(groupAddress), executor)
                    .exceptionally(e -> {
                        log.warn("Failed to read deadline for group {}: {}", groupAddress,
                                e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                        return Optional.empty();
                    }));
        }

        awaitReads(reads.values(), properties.getNotifications().getGroupReadTimeout());

        List<DeadlineSnapshot> snapshots = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<Optional<DeadlineSnapshot>>> read : reads.entrySet()) {
            if (read.getValue().isDone()) {
                read.getValue().join().ifPresent(snapshots::add);
            } else {
                read.getValue().cancel(true);
                log.warn("Timed out reading deadline for group {}", read.getKey());
            }
        }

        for (DeadlineSnapshot snapshot : snapshots) {
            try {
                notifier.onTick(snapshot);
            } catch (Exception e) {
                log.error("Error evaluating deadline for group {}: {}", snapshot.getGroupAddress(), e.getMessage(), e);
            }
        }
    }

    Optional<DeadlineSnapshot> readSnapshot(String groupAddress) {
        GroupInfo info = groupReader.getGroupInfo(groupAddress);
        if (!info.isActive()) {
            log.debug("Group {} inactive, no deadline to watch", groupAddress);
            return Optional.empty();
        }

        Instant deadline = Instant.ofEpochSecond(groupReader.getRoundDeadline(groupAddress).longValueExact());

        return Optional.of(DeadlineSnapshot.builder()
                .groupAddress(groupAddress)
                .groupName(info.getName())
                .roundNumber(info.getCurrentRound().longValueExact())
                .deadline(deadline)
                .observedAt(clock.instant())
                .build());
    }

    private void awaitReads(Collection<CompletableFuture<Optional<DeadlineSnapshot>>> reads, Duration timeout) {
        TimeLimiter timeLimiter = TimeLimiter.of("deadlineReads", TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .build());
        try {
            timeLimiter.executeFutureSupplier(() -> CompletableFuture.allOf(reads.toArray(new CompletableFuture[0])));
        } catch (TimeoutException e) {
            log.warn("Deadline reads not finished within {}; evaluating the groups read so far", timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for deadline reads");
        } catch (Exception e) {
            log.warn("Deadline reads failed: {}", e.getMessage());
        }
    }
}
