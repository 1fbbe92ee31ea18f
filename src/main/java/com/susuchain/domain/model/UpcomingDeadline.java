package com.susuchain.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpcomingDeadline {

    private String groupAddress;
    private String groupName;
    private long roundNumber;
    private long deadline;
    private long timeRemaining;
    private boolean hasContributed;

    /**
     * Drops elapsed deadlines and rounds already contributed to, most urgent first.
     */
    public static List<UpcomingDeadline> sortByUrgency(List<UpcomingDeadline> deadlines) {
        return deadlines.stream()
                .filter(d -> d.getTimeRemaining() > 0 && !d.isHasContributed())
                .sorted(Comparator.comparingLong(UpcomingDeadline::getTimeRemaining))
                .collect(Collectors.toList());
    }
}
