package com.example.triage.model;

public record DispatchClaim(Session session, boolean claimed) {}
