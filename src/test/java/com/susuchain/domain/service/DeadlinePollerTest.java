package com.susuchain.domain.service;

import com.susuchain.config.AutomationProperties;
import com.susuchain.domain.exception.ChainReadException;
import com.susuchain.domain.model.DeadlineSnapshot;
import com.susuchain.domain.model.GroupInfo;
import com.susuchain.infrastructure.chain.SusuGroupReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeadlinePollerTest {

    private static final String GROUP_A = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";
    private static final String GROUP_B = "0xbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb";
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    @Mock private SusuGroupReader groupReader;
    @Mock private DeadlineNotifier notifier;

    private AutomationProperties properties;
    private DeadlinePoller poller;

    @BeforeEach
    void setUp() {
        properties = new AutomationProperties();
        poller = new DeadlinePoller(groupReader, notifier, Runnable::run, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void readSnapshot_activeGroup() {
        when(groupReader.getGroupInfo(GROUP_A)).thenReturn(group("Alpha", true, 4));
        when(groupReader.getRoundDeadline(GROUP_A)).thenReturn(BigInteger.valueOf(NOW.getEpochSecond() + 3600));

        DeadlineSnapshot snapshot = poller.readSnapshot(GROUP_A).orElseThrow();

        assertEquals("Alpha", snapshot.getGroupName());
        assertEquals(4, snapshot.getRoundNumber());
        assertEquals(NOW, snapshot.getObservedAt());
        assertEquals(3600, snapshot.timeRemainingSeconds());
    }

    @Test
    void readSnapshot_inactiveGroup_empty() {
        when(groupReader.getGroupInfo(GROUP_A)).thenReturn(group("Alpha", false, 4));

        assertEquals(Optional.empty(), poller.readSnapshot(GROUP_A));
        verify(groupReader, never()).getRoundDeadline(anyString());
    }

    @Test
    void poll_failingGroupDoesNotBlockOthers() {
        properties.getNotifications().setWatchedGroups(List.of(GROUP_A, GROUP_B));
        when(groupReader.getGroupInfo(GROUP_A)).thenThrow(
                new ChainReadException("getGroupInfo failed", GROUP_A, "getGroupInfo()"));
        when(groupReader.getGroupInfo(GROUP_B)).thenReturn(group("Beta", true, 2));
        when(groupReader.getRoundDeadline(GROUP_B)).thenReturn(BigInteger.valueOf(NOW.getEpochSecond() - 60));

        poller.poll();

        ArgumentCaptor<DeadlineSnapshot> ticks = ArgumentCaptor.forClass(DeadlineSnapshot.class);
        verify(notifier, times(1)).onTick(ticks.capture());
        assertEquals(GROUP_B, ticks.getValue().getGroupAddress());
        assertEquals(-60, ticks.getValue().timeRemainingSeconds());
    }

    @Test
    void poll_slowGroupsShareOneTickDeadline() {
        String healthy = "0xeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeee";
        List<String> slow = List.of(GROUP_A, GROUP_B,
                "0xcccccccccccccccccccccccccccccccccccccccc",
                "0xdddddddddddddddddddddddddddddddddddddddd");
        properties.getNotifications().setWatchedGroups(List.of(slow.get(0), slow.get(1), slow.get(2), slow.get(3), healthy));
        properties.getNotifications().setGroupReadTimeout(Duration.ofMillis(500));

        CountDownLatch release = new CountDownLatch(1);
        for (String group : slow) {
            lenient().when(groupReader.getGroupInfo(group)).thenAnswer(invocation -> {
                release.await(3, TimeUnit.SECONDS);
                return group("Slow", false, 1);
            });
        }
        when(groupReader.getGroupInfo(healthy)).thenReturn(group("Healthy", true, 1));
        when(groupReader.getRoundDeadline(healthy)).thenReturn(BigInteger.valueOf(NOW.getEpochSecond() + 600));

        ExecutorService executor = Executors.newFixedThreadPool(5);
        try {
            DeadlinePoller parallel = new DeadlinePoller(groupReader, notifier, executor, properties,
                    Clock.fixed(NOW, ZoneOffset.UTC));

            long start = System.nanoTime();
            parallel.poll();
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(elapsedMillis < 1500, "poll took " + elapsedMillis + "ms");
            ArgumentCaptor<DeadlineSnapshot> ticks = ArgumentCaptor.forClass(DeadlineSnapshot.class);
            verify(notifier, times(1)).onTick(ticks.capture());
            assertEquals(healthy, ticks.getValue().getGroupAddress());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void poll_noWatchedGroups_noReads() {
        poller.poll();

        verifyNoInteractions(groupReader, notifier);
    }

    private static GroupInfo group(String name, boolean active, long round) {
        return GroupInfo.builder()
                .name(name)
                .active(active)
                .currentRound(BigInteger.valueOf(round))
                .build();
    }
}
