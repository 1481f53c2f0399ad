package com.example.triage.model;

public enum MessageRole { CUSTOMER, ASSISTANT, SYSTEM }
