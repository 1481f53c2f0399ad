package com.example.triage.model;

public enum TraceKind { CYCLE, APPROVAL_RESOLVED }
