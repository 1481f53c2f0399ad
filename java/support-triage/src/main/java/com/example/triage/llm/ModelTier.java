package com.example.triage.llm;

/**
 * Which of a route's models a call runs against. FAST covers classification and reply
 * evaluation; CAPABLE writes customer replies.
 */
public enum ModelTier {
    FAST,
    CAPABLE
}
