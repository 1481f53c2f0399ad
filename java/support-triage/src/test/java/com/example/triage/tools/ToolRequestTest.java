package com.example.triage.tools;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.example.triage.error.ToolExecutionFailedException;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.*;

class ToolRequestTest {

    @Test
    void argumentNamesBecomeParameterNames() {
        assertEquals("newFrequency", ToolRequest.camelCase("new_frequency"));
        assertEquals("durationMonths", ToolRequest.camelCase("duration_months"));
        assertEquals("reason", ToolRequest.camelCase("reason"));
        assertEquals("orderId", ToolRequest.camelCase("orderId"));
        assertEquals("private", ToolRequest.camelCase("_private"));
    }

    @Test
    void inputIsJsonKeyedByParameterName() {
        var request = new ToolRequest("s-1", "jane@example.com", Map.of("item_description", "candle"));
        assertEquals("{\"itemDescription\":\"candle\"}", request.input(new ObjectMapper()));
    }

    @Test
    void contextCarriesSessionAndCustomer() {
        var context = new ToolRequest("s-1", "jane@example.com", Map.of()).context();
        assertEquals("s-1", ToolRequest.session(context));
        assertEquals("jane@example.com", ToolRequest.customer(context, "get_subscription"));
    }

    @Test
    void missingCustomerIsADomainFailure() {
        var context = new ToolRequest("s-1", " ", Map.of()).context();
        var e = assertThrows(ToolExecutionFailedException.class, () -> ToolRequest.customer(context, "track_package"));
        assertEquals("track_package", e.toolName());
    }
}
