package com.susuchain.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one bootstrap run, one entry per group enumerated from the factory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BootstrapReport {

    private Instant startedAt;
    private Instant finishedAt;

    @Builder.Default
    private List<GroupOutcome> groups = new ArrayList<>();

    public long count(Outcome outcome) {
        return groups.stream().filter(g -> g.getOutcome() == outcome).count();
    }

    public enum Outcome {
        DUTY_CREATED,
        ALREADY_WIRED,
        SKIPPED_INACTIVE,
        FAILED
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GroupOutcome {
        private String groupAddress;
        private String groupName;
        private Outcome outcome;
        private String dutyId;
        private boolean executorSet;
        private String message;
    }
}
