package com.example.triage.tools;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.ai.chat.model.ToolContext;

import com.example.triage.error.ToolExecutionFailedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * One tool call: the customer comes from the session, the arguments from classification.
 * Tool methods see the session and customer through the {@link ToolContext} and the
 * arguments as their own parameters.
 */
public record ToolRequest(String sessionId, String customerId, Map<String, String> arguments) {

    static final String SESSION_ID = "session_id";
    static final String CUSTOMER_ID = "customer_id";

    public ToolRequest {
        arguments = arguments != null ? Map.copyOf(arguments) : Map.of();
    }

    public String argument(String name) {
        return arguments.get(name);
    }

    public ToolContext context() {
        var context = new HashMap<String, Object>();
        context.put(SESSION_ID, sessionId);
        if (customerId != null) {
            context.put(CUSTOMER_ID, customerId);
        }
        return new ToolContext(context);
    }

    /** Callback input. Classification names arguments in snake_case; tool parameters are camelCase. */
    String input(ObjectMapper mapper) {
        var input = new LinkedHashMap<String, String>();
        arguments.forEach((name, value) -> input.put(camelCase(name), value));
        try {
            return mapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionFailedException("payload", "Unwritable tool arguments", e);
        }
    }

    static String session(ToolContext context) {
        return context != null ? (String) context.getContext().get(SESSION_ID) : null;
    }

    static String customer(ToolContext context, String tool) {
        Object customer = context != null ? context.getContext().get(CUSTOMER_ID) : null;
        if (!(customer instanceof String id) || id.isBlank()) {
            throw new ToolExecutionFailedException(tool, "Session has no known customer");
        }
        return id;
    }

    static String camelCase(String name) {
        var out = new StringBuilder(name.length());
        boolean upper = false;
        for (char c : name.toCharArray()) {
            if (c == '_') {
                upper = out.length() > 0;
            } else {
                out.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return out.toString();
    }
}
