package com.example.triage.model;

public enum EscalationPriority { LOW, MEDIUM, HIGH, URGENT }
