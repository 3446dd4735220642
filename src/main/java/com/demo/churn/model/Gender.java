package com.demo.churn.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum Gender {
    MALE("Male", "Homme"),
    FEMALE("Female", "Femme");

    private final String label;
    private final String frenchLabel;

    public static Optional<Gender> fromLabel(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim();
        return Arrays.stream(values())
                .filter(g -> g.name().equalsIgnoreCase(s) || g.label.equalsIgnoreCase(s) || g.frenchLabel.equalsIgnoreCase(s))
                .findFirst();
    }
}
