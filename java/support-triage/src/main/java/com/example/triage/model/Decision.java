package com.example.triage.model;

import java.util.Locale;

public enum Decision {
    SEND,
    DRAFT,
    ESCALATE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
