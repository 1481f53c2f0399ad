package com.example.triage.tools;

import java.util.Objects;

import org.springframework.ai.tool.ToolCallback;

/**
 * A tool callback with the metadata the engine needs. {@code requiresApproval} belongs to the
 * tool, never to an individual call.
 */
public record RegisteredTool(String name, String description, boolean requiresApproval, ToolCallback callback) {

    public RegisteredTool {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(callback, "callback");
    }

    static RegisteredTool of(ToolCallback callback, boolean requiresApproval) {
        var definition = callback.getToolDefinition();
        return new RegisteredTool(definition.name(), definition.description(), requiresApproval, callback);
    }
}
