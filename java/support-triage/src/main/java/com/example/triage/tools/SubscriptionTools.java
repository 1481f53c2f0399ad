package com.example.triage.tools;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.triage.error.ToolExecutionFailedException;

/**
 * Subscription changes. Every tool here is approval-gated: the method only runs after a
 * reviewer approved the execution. Each change and its audit row commit together.
 */
@Component
public class SubscriptionTools implements ToolProvider {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionTools.class);
    private static final Set<String> FREQUENCIES = Set.of("monthly", "bi-monthly", "quarterly");
    private static final Set<String> GATED = Set.of(
        "pause_subscription", "skip_month", "change_frequency", "change_address", "cancel_subscription");

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;

    public SubscriptionTools(JdbcTemplate jdbc, TransactionTemplate commerceTransactions) {
        this.jdbc = jdbc;
        this.transactions = commerceTransactions;
    }

    @Override
    public Set<String> approvalGated() {
        return GATED;
    }

    @Tool(name = "pause_subscription", description = "Pause the subscription for 1 to 3 months")
    public Map<String, Object> pause(
            @ToolParam(description = "Months to pause, 1 to 3 (default 1)", required = false) String durationMonths,
            ToolContext context) {
        int months = parseMonths(durationMonths);
        return change(context, "pause_subscription", "duration_months=" + months, subscriptionId -> jdbc.update(
            """
            UPDATE subscriptions SET status = 'paused',
                   paused_until = COALESCE(next_shipment_date, CURRENT_DATE) + make_interval(months => ?)
            WHERE id = ?
            """, months, subscriptionId));
    }

    @Tool(name = "skip_month", description = "Skip the next scheduled shipment")
    public Map<String, Object> skipMonth(
            @ToolParam(description = "Month to skip, e.g. 2024-07 (default next)", required = false) String month,
            ToolContext context) {
        return change(context, "skip_month", "month=" + orDefault(month, "next"), subscriptionId -> jdbc.update(
            "UPDATE subscriptions SET next_shipment_date = next_shipment_date + INTERVAL '1 month' WHERE id = ?",
            subscriptionId));
    }

    @Tool(name = "change_frequency", description = "Switch delivery frequency to monthly, bi-monthly or quarterly")
    public Map<String, Object> changeFrequency(
            @ToolParam(description = "monthly, bi-monthly or quarterly") String newFrequency,
            ToolContext context) {
        String frequency = require("change_frequency", "new_frequency", newFrequency).toLowerCase(Locale.ROOT);
        if (!FREQUENCIES.contains(frequency)) {
            throw new ToolExecutionFailedException("change_frequency", "Unsupported frequency: " + frequency);
        }
        return change(context, "change_frequency", "new_frequency=" + frequency, subscriptionId ->
            jdbc.update("UPDATE subscriptions SET frequency = ? WHERE id = ?", frequency, subscriptionId));
    }

    @Tool(name = "change_address", description = "Change the shipping address of the subscription")
    public Map<String, Object> changeAddress(
            @ToolParam(description = "Full new shipping address") String newAddress,
            ToolContext context) {
        String address = require("change_address", "new_address", newAddress);
        return change(context, "change_address", "new_address updated", subscriptionId ->
            jdbc.update("UPDATE subscriptions SET shipping_address = ? WHERE id = ?", address, subscriptionId));
    }

    @Tool(name = "cancel_subscription", description = "Cancel the subscription at the end of the paid period")
    public Map<String, Object> cancel(
            @ToolParam(description = "Why the customer is leaving", required = false) String reason,
            ToolContext context) {
        return change(context, "cancel_subscription", "reason=" + orDefault(reason, "not given"), subscriptionId ->
            jdbc.update("UPDATE subscriptions SET status = 'cancel_pending' WHERE id = ?", subscriptionId));
    }

    private interface Change {
        void apply(UUID subscriptionId);
    }

    private Map<String, Object> change(ToolContext context, String action, String detail, Change change) {
        String customer = ToolRequest.customer(context, action);
        log.info("Tool call: {}(customer={})", action, customer);
        return transactions.execute(status -> {
            UUID subscriptionId = activeSubscription(customer, action);
            change.apply(subscriptionId);
            jdbc.update(
                """
                INSERT INTO subscription_change_requests (subscription_id, session_id, action, detail, status)
                VALUES (?, ?, ?, ?, 'applied')
                """, subscriptionId, ToolRequest.session(context), action, detail);
            return Map.of(
                "subscription_id", subscriptionId.toString(),
                "action", action,
                "detail", detail,
                "status", "applied"
            );
        });
    }

    private UUID activeSubscription(String customer, String tool) {
        var rows = jdbc.queryForList(
            """
            SELECT s.id FROM subscriptions s JOIN customers c ON s.customer_id = c.id
            WHERE %s AND s.status IN ('active', 'paused')
            ORDER BY s.created_at DESC LIMIT 1
            FOR UPDATE OF s
            """.formatted(AccountTools.CUSTOMER_MATCH), customer, customer);
        if (rows.isEmpty()) {
            throw new ToolExecutionFailedException(tool, "No active subscription for customer " + customer);
        }
        return (UUID) rows.get(0).get("id");
    }

    private static String require(String tool, String argument, String value) {
        if (value == null || value.isBlank()) {
            throw new ToolExecutionFailedException(tool, "Missing argument '" + argument + "'");
        }
        return value.strip();
    }

    private static int parseMonths(String value) {
        if (value == null || value.isBlank()) {
            return 1;
        }
        try {
            return Math.max(1, Math.min(Integer.parseInt(value.strip()), 3));
        } catch (NumberFormatException e) {
            throw new ToolExecutionFailedException("pause_subscription", "Invalid duration: " + value);
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
