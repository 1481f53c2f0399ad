package com.example.triage.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Closed support taxonomy. {@link #UNCATEGORIZED} is the sentinel for
 * low-confidence or unparseable classifications and is never chosen by the model.
 */
public enum Category {
    TRACKING("tracking"),
    BILLING("billing"),
    RETENTION("retention"),
    DAMAGE_CLAIM("damage_claim"),
    SUBSCRIPTION_CHANGE("subscription_change"),
    GRATITUDE("gratitude"),
    GENERAL("general"),
    UNCATEGORIZED("uncategorized");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static List<Category> assignable() {
        return Arrays.stream(values()).filter(c -> c != UNCATEGORIZED).toList();
    }

    public static Category fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return UNCATEGORIZED;
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT).replace('-', '_');
        for (Category category : values()) {
            if (category.label.equals(normalized) || category.name().equalsIgnoreCase(normalized)) {
                return category;
            }
        }
        return UNCATEGORIZED;
    }
}
