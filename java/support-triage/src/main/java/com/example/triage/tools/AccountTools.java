package com.example.triage.tools;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.example.triage.error.ToolExecutionFailedException;

/** Read-only customer and subscription lookups. Customers are addressed by email or id. */
@Component
public class AccountTools implements ToolProvider {

    private static final Logger log = LoggerFactory.getLogger(AccountTools.class);
    private static final int DEFAULT_PAYMENT_MONTHS = 6;

    static final String CUSTOMER_MATCH = "(c.email = ? OR CAST(c.id AS VARCHAR) = ?)";

    private final JdbcTemplate jdbc;

    public AccountTools(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Tool(name = "get_subscription",
        description = "Current subscription of the customer: plan, status, frequency, next shipment")
    public Map<String, Object> getSubscription(ToolContext context) {
        String customer = ToolRequest.customer(context, "get_subscription");
        log.info("Tool call: get_subscription(customer={})", customer);
        var rows = jdbc.queryForList(
            """
            SELECT s.id AS subscription_id, s.plan, s.status, s.frequency,
                   s.next_shipment_date, s.paused_until, c.name AS customer_name
            FROM subscriptions s JOIN customers c ON s.customer_id = c.id
            WHERE %s
            ORDER BY s.created_at DESC LIMIT 1
            """.formatted(CUSTOMER_MATCH), customer, customer);

        if (rows.isEmpty()) {
            throw new ToolExecutionFailedException("get_subscription", "No subscription for customer " + customer);
        }
        return rows.get(0);
    }

    @Tool(name = "get_customer_history", description = "Recent orders of the customer")
    public List<Map<String, Object>> getCustomerHistory(ToolContext context) {
        String customer = ToolRequest.customer(context, "get_customer_history");
        log.info("Tool call: get_customer_history(customer={})", customer);
        return jdbc.queryForList(
            """
            SELECT o.order_id, o.status, o.total_amount, o.created_at
            FROM orders o JOIN customers c ON o.customer_id = c.id
            WHERE %s
            ORDER BY o.created_at DESC LIMIT 10
            """.formatted(CUSTOMER_MATCH), customer, customer);
    }

    @Tool(name = "get_payment_history", description = "Payments of the customer over the last months")
    public List<Map<String, Object>> getPaymentHistory(
            @ToolParam(description = "How many months back, 1 to 24 (default 6)", required = false) String months,
            ToolContext context) {
        String customer = ToolRequest.customer(context, "get_payment_history");
        int monthsBack = parseMonths(months);
        log.info("Tool call: get_payment_history(customer={}, months={})", customer, monthsBack);
        return jdbc.queryForList(
            """
            SELECT p.amount, p.currency, p.status, p.paid_at
            FROM payments p JOIN customers c ON p.customer_id = c.id
            WHERE %s AND p.paid_at >= NOW() - make_interval(months => ?)
            ORDER BY p.paid_at DESC
            """.formatted(CUSTOMER_MATCH), customer, customer, monthsBack);
    }

    private static int parseMonths(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_PAYMENT_MONTHS;
        }
        try {
            return Math.max(1, Math.min(Integer.parseInt(value.strip()), 24));
        } catch (NumberFormatException e) {
            return DEFAULT_PAYMENT_MONTHS;
        }
    }
}
