package com.example.triage.model;

public record SafetySignal(boolean flagged, String trigger) {

    public static SafetySignal none() {
        return new SafetySignal(false, null);
    }

    public static SafetySignal of(String trigger) {
        return new SafetySignal(true, trigger);
    }
}
