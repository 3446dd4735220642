package com.demo.churn.model;

import java.util.Arrays;
import java.util.Optional;

/** Loyalty category of the customer. RUBIS is the entry tier. */
public enum CustomerTier {
    RUBIS,
    SILVER,
    GOLD,
    PLATINUM;

    public static Optional<CustomerTier> fromLabel(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim();
        return Arrays.stream(values()).filter(t -> t.name().equalsIgnoreCase(s)).findFirst();
    }
}
