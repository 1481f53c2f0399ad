package com.example.triage.tools;

import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.example.triage.error.ToolExecutionFailedException;

@Component
public class DamageTools implements ToolProvider {

    private static final Logger log = LoggerFactory.getLogger(DamageTools.class);

    private final JdbcTemplate jdbc;

    public DamageTools(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Set<String> approvalGated() {
        return Set.of("create_damage_claim");
    }

    @Tool(name = "create_damage_claim", description = "Open a damage claim for an item that arrived damaged or leaking")
    public Map<String, Object> createDamageClaim(
            @ToolParam(description = "Which item was damaged", required = false) String itemDescription,
            @ToolParam(description = "Kind of damage, e.g. crushed, leaking, broken", required = false)
            String damageType,
            ToolContext context) {
        String customer = ToolRequest.customer(context, "create_damage_claim");
        log.info("Tool call: create_damage_claim(customer={}, item={})", customer, itemDescription);

        var customers = jdbc.queryForList(
            "SELECT c.id FROM customers c WHERE " + AccountTools.CUSTOMER_MATCH, customer, customer);
        if (customers.isEmpty()) {
            throw new ToolExecutionFailedException("create_damage_claim", "Unknown customer " + customer);
        }

        String claimId = jdbc.queryForObject(
            """
            INSERT INTO damage_claims (customer_id, session_id, item_description, damage_type, status)
            VALUES (?, ?, ?, ?, 'open')
            RETURNING claim_id
            """, String.class, customers.get(0).get("id"), ToolRequest.session(context),
            itemDescription != null ? itemDescription : "unspecified", damageType != null ? damageType : "damaged");

        return Map.of(
            "claim_id", claimId,
            "status", "open",
            "message", "Damage claim opened; a replacement or credit follows review."
        );
    }

    @Tool(name = "request_photos", description = "Instructions for the customer to send photos of the damage")
    public Map<String, Object> requestPhotos(ToolContext context) {
        log.info("Tool call: request_photos(session={})", ToolRequest.session(context));
        return Map.of(
            "instructions", "Please reply with photos of the damaged item and the outer box, including the shipping label.",
            "status", "awaiting_photos"
        );
    }
}
