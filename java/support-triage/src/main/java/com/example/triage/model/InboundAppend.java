package com.example.triage.model;

public record InboundAppend(Session session, Message message, boolean duplicate) {}
