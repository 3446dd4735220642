package com.demo.churn.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum Country {
    FRANCE("France", "France"),
    GERMANY("Germany", "Allemagne"),
    SPAIN("Spain", "Espagne");

    private final String label;
    private final String frenchLabel;

    public static Optional<Country> fromLabel(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim();
        return Arrays.stream(values())
                .filter(c -> c.name().equalsIgnoreCase(s) || c.label.equalsIgnoreCase(s) || c.frenchLabel.equalsIgnoreCase(s))
                .findFirst();
    }
}
