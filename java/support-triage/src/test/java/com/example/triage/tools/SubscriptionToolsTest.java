package com.example.triage.tools;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.triage.error.ToolExecutionFailedException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SubscriptionToolsTest {

    private static final UUID SUBSCRIPTION = UUID.fromString("00000000-0000-0000-0000-00000000a001");

    private final JdbcTemplate jdbc = mock(JdbcTemplate.class);
    private final PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);
    private final SubscriptionTools tools = new SubscriptionTools(jdbc, new TransactionTemplate(transactionManager));

    private static ToolContext jane() {
        return new ToolRequest("s-1", "jane@example.com", Map.of()).context();
    }

    private void activeSubscription() {
        when(jdbc.queryForList(contains("FROM subscriptions"), eq("jane@example.com"), eq("jane@example.com")))
            .thenReturn(List.of(Map.of("id", SUBSCRIPTION)));
    }

    @Test
    void pauseIsCappedAtThreeMonths() {
        activeSubscription();
        Map<String, Object> result = tools.pause("6", jane());

        assertEquals("applied", result.get("status"));
        assertEquals("duration_months=3", result.get("detail"));
        verify(jdbc).update(contains("status = 'paused'"), eq(3), eq(SUBSCRIPTION));
        verify(jdbc).update(contains("subscription_change_requests"),
            eq(SUBSCRIPTION), eq("s-1"), eq("pause_subscription"), eq("duration_months=3"));
    }

    @Test
    void cancelMarksSubscriptionPending() {
        activeSubscription();
        tools.cancel("moving abroad", jane());
        verify(jdbc).update(contains("cancel_pending"), eq(SUBSCRIPTION));
        verify(jdbc).update(contains("subscription_change_requests"),
            eq(SUBSCRIPTION), eq("s-1"), eq("cancel_subscription"), eq("reason=moving abroad"));
    }

    @Test
    void changeAndAuditRowCommitTogether() {
        activeSubscription();
        tools.skipMonth(null, jane());
        verify(transactionManager).commit(any());
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    void failedAuditInsertRollsBackTheChange() {
        activeSubscription();
        when(jdbc.update(contains("subscription_change_requests"), eq(SUBSCRIPTION), eq("s-1"),
            eq("cancel_subscription"), anyString()))
            .thenThrow(new DataIntegrityViolationException("audit insert failed"));

        assertThrows(DataIntegrityViolationException.class, () -> tools.cancel(null, jane()));
        verify(jdbc).update(contains("cancel_pending"), eq(SUBSCRIPTION));
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void unsupportedFrequencyFailsBeforeAnyWrite() {
        assertThrows(ToolExecutionFailedException.class, () -> tools.changeFrequency("Weekly", jane()));
        verify(jdbc, never()).update(anyString(), eq("weekly"), eq(SUBSCRIPTION));
        verify(transactionManager, never()).getTransaction(any());
    }

    @Test
    void frequencyIsNormalized() {
        activeSubscription();
        tools.changeFrequency(" Quarterly ", jane());
        verify(jdbc).update(contains("SET frequency"), eq("quarterly"), eq(SUBSCRIPTION));
    }

    @Test
    void addressIsRequired() {
        var e = assertThrows(ToolExecutionFailedException.class, () -> tools.changeAddress(" ", jane()));
        assertEquals("change_address", e.toolName());
    }

    @Test
    void noActiveSubscriptionFails() {
        when(jdbc.queryForList(anyString(), eq("jane@example.com"), eq("jane@example.com"))).thenReturn(List.of());
        var e = assertThrows(ToolExecutionFailedException.class, () -> tools.skipMonth(null, jane()));
        assertEquals("skip_month", e.toolName());
        verify(transactionManager).rollback(any());
    }

    @Test
    void unknownCustomerFails() {
        var anonymous = new ToolRequest("s-1", null, Map.of()).context();
        assertThrows(ToolExecutionFailedException.class, () -> tools.cancel(null, anonymous));
    }
}
