package com.example.triage.tools;

import java.util.Set;

import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

/**
 * Implemented by the tool beans; collected once into the {@link ToolRegistry}. Tools are the
 * bean's {@code @Tool} methods.
 */
public interface ToolProvider {

    default ToolCallback[] toolCallbacks() {
        return MethodToolCallbackProvider.builder().toolObjects(this).build().getToolCallbacks();
    }

    /** Names of this provider's tools that only run after a reviewer approves them. */
    default Set<String> approvalGated() {
        return Set.of();
    }
}
