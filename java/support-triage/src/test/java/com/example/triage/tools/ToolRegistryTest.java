package com.example.triage.tools;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.triage.error.UnknownToolException;
import com.example.triage.model.Category;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolRegistryTest {

    private final JdbcTemplate jdbc = mock(JdbcTemplate.class);
    private final TransactionTemplate transactions = new TransactionTemplate(mock(PlatformTransactionManager.class));
    private final ToolRegistry registry = new ToolRegistry(List.of(new AccountTools(jdbc), new ShippingTools(jdbc),
        new SubscriptionTools(jdbc, transactions), new DamageTools(jdbc)));

    @Test
    void writeActionsRequireApproval() {
        for (String name : StubTools.ACTIONS) {
            assertTrue(registry.require(name).requiresApproval(), name);
        }
    }

    @Test
    void lookupsRunWithoutApproval() {
        for (String name : StubTools.LOOKUPS) {
            assertFalse(registry.require(name).requiresApproval(), name);
        }
    }

    @Test
    void toolSchemasNameTheMethodParameters() {
        RegisteredTool tool = registry.require("create_damage_claim");
        String schema = tool.callback().getToolDefinition().inputSchema();
        assertTrue(schema.contains("itemDescription"), schema);
        assertTrue(schema.contains("damageType"), schema);
        assertFalse(schema.contains("context"), schema);
        assertEquals("Open a damage claim for an item that arrived damaged or leaking", tool.description());
    }

    @Test
    void callbackRunsWithCustomerFromContextAndSnakeCaseArguments() {
        when(jdbc.queryForList(contains("FROM payments"), eq("jane@example.com"), eq("jane@example.com"), eq(3)))
            .thenReturn(List.of(Map.of("amount", 29, "status", "paid")));
        var request = new ToolRequest("s-1", "jane@example.com", Map.of("months", "3"));

        String result = registry.require("get_payment_history").callback()
            .call(request.input(new ObjectMapper()), request.context());

        assertTrue(result.contains("\"status\":\"paid\""), result);
    }

    @Test
    void unknownToolIsRejected() {
        assertThrows(UnknownToolException.class, () -> registry.require("refund_order"));
        assertTrue(registry.find("refund_order").isEmpty());
    }

    @ParameterizedTest
    @EnumSource(Category.class)
    void everyCategoryHasPlan(Category category) {
        assertNotNull(registry.plan(category));
    }

    @Test
    void onlyTrackingAndGratitudeAutoSend() {
        List<Category> autoSend = Category.assignable().stream()
            .filter(category -> registry.plan(category).autoSend())
            .toList();
        assertEquals(List.of(Category.TRACKING, Category.GRATITUDE), autoSend);
    }

    @Test
    void retentionDefaultsToCancellation() {
        CategoryPlan plan = registry.plan(Category.RETENTION);
        assertEquals("cancel_subscription", plan.actionFor(null));
        assertEquals("cancel_subscription", plan.actionFor("refund_order"));
    }

    @Test
    void subscriptionChangeActsOnlyOnClassifierPick() {
        CategoryPlan plan = registry.plan(Category.SUBSCRIPTION_CHANGE);
        assertNull(plan.actionFor(null));
        assertEquals("skip_month", plan.actionFor("skip_month"));
        assertNull(plan.actionFor("cancel_subscription"));
    }

    @Test
    void duplicateToolNamesFailAtStartup() {
        ToolProvider twice = new ToolProvider() {
            @Override
            public ToolCallback[] toolCallbacks() {
                return new AccountTools(jdbc).toolCallbacks();
            }
        };
        assertThrows(IllegalStateException.class,
            () -> new ToolRegistry(List.of(new AccountTools(jdbc), twice)));
    }

    @Test
    void approvalForMissingToolFailsAtStartup() {
        var shipping = new ShippingTools(jdbc);
        ToolProvider gatedTypo = new ToolProvider() {
            @Override
            public ToolCallback[] toolCallbacks() {
                return shipping.toolCallbacks();
            }

            @Override
            public Set<String> approvalGated() {
                return Set.of("track_packages");
            }
        };
        assertThrows(IllegalStateException.class, () -> new ToolRegistry(List.of(gatedTypo)));
    }

    @Test
    void planWithMissingToolFailsAtStartup() {
        assertThrows(UnknownToolException.class, () -> new ToolRegistry(List.of(new AccountTools(jdbc))));
    }
}
