package com.fintech.anomaly.domain;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dimension that triggered an anomaly.
 */
public enum AnomalyReason {
    PRICE("price"),
    VOLUME("volume"),
    VOLATILITY("volatility");

    private static final String SEPARATOR = "+";

    private final String tag;

    AnomalyReason(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Joins reasons into their storage form in declaration order, e.g. "price+volume".
     * Returns an empty string for no reasons.
     */
    public static String join(Collection<AnomalyReason> reasons) {
        return reasons.stream()
            .sorted()
            .map(AnomalyReason::tag)
            .collect(Collectors.joining(SEPARATOR));
    }

    /**
     * Parses the storage form produced by {@link #join(Collection)}.
     *
     * @throws IllegalArgumentException on an unknown tag
     */
    public static Set<AnomalyReason> parse(String joined) {
        Set<AnomalyReason> reasons = EnumSet.noneOf(AnomalyReason.class);
        if (joined == null || joined.isBlank()) {
            return reasons;
        }
        for (String tag : joined.split("\\" + SEPARATOR)) {
            reasons.add(fromTag(tag.trim()));
        }
        return reasons;
    }

    public static AnomalyReason fromTag(String tag) {
        return Arrays.stream(values())
            .filter(reason -> reason.tag.equalsIgnoreCase(tag))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown anomaly reason: " + tag));
    }
}
