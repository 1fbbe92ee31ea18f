package com.susuchain.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Deadline proximity alert levels, most urgent last.
 */
public enum NotificationTier {

    TIER_24H("24h", 24 * 60 * 60, false,
            "⏰ Reminder: You have 24 hours to contribute to %s (Round %d)"),
    TIER_6H("6h", 6 * 60 * 60, false,
            "⚠️ Urgent: Only 6 hours left to contribute to %s (Round %d)"),
    TIER_1H("1h", 60 * 60, true,
            "🚨 Last hour! Contribute to %s (Round %d) before deadline"),
    OVERDUE("overdue", 0, true,
            "❌ Deadline passed for %s (Round %d). Late penalty may apply.");

    /**
     * Timed tiers in selection precedence: most urgent first.
     */
    public static final List<NotificationTier> TIMED_BY_URGENCY = List.of(TIER_1H, TIER_6H, TIER_24H);

    private final String code;
    private final long thresholdSeconds;
    private final boolean requireInteraction;
    private final String template;

    NotificationTier(String code, long thresholdSeconds, boolean requireInteraction, String template) {
        this.code = code;
        this.thresholdSeconds = thresholdSeconds;
        this.requireInteraction = requireInteraction;
        this.template = template;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public long getThresholdSeconds() {
        return thresholdSeconds;
    }

    public boolean isRequireInteraction() {
        return requireInteraction;
    }

    public String render(String groupName, long roundNumber) {
        return String.format(template, groupName, roundNumber);
    }

    public static NotificationTier fromCode(String code) {
        return Arrays.stream(values())
                .filter(tier -> tier.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown notification tier: " + code));
    }
}
