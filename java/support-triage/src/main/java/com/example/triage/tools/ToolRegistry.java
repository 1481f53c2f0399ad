package com.example.triage.tools;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Component;

import com.example.triage.error.UnknownToolException;
import com.example.triage.model.Category;

/**
 * Immutable table of tool callbacks and category plans, built once at startup. Lookups are
 * plain reads; nothing registers or removes tools afterwards.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, RegisteredTool> tools;
    private final Map<Category, CategoryPlan> plans;

    public ToolRegistry(List<ToolProvider> providers) {
        var byName = new LinkedHashMap<String, RegisteredTool>();
        for (ToolProvider provider : providers) {
            Set<String> gated = provider.approvalGated();
            int before = byName.size();
            for (ToolCallback callback : provider.toolCallbacks()) {
                var tool = RegisteredTool.of(callback, gated.contains(callback.getToolDefinition().name()));
                if (byName.putIfAbsent(tool.name(), tool) != null) {
                    throw new IllegalStateException("Tool registered twice: " + tool.name());
                }
            }
            long matched = byName.values().stream().skip(before).filter(RegisteredTool::requiresApproval).count();
            if (matched != gated.size()) {
                throw new IllegalStateException("Approval declared for a tool " + provider.getClass().getSimpleName()
                    + " does not provide: " + gated);
            }
        }
        this.tools = Map.copyOf(byName);
        this.plans = Map.copyOf(defaultPlans());
        verifyPlans();
        log.info("Tool registry loaded: {} tools, {} approval-gated",
            tools.size(), tools.values().stream().filter(RegisteredTool::requiresApproval).count());
    }

    public RegisteredTool require(String name) {
        var tool = tools.get(name);
        if (tool == null) {
            throw new UnknownToolException(name);
        }
        return tool;
    }

    public Optional<RegisteredTool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public CategoryPlan plan(Category category) {
        return plans.get(category);
    }

    private void verifyPlans() {
        for (Category category : Category.values()) {
            var plan = plans.get(category);
            if (plan == null) {
                throw new IllegalStateException("No plan for category " + category);
            }
            Stream.concat(plan.lookups().stream(), plan.actions().stream()).forEach(name -> {
                var tool = require(name);
                boolean isAction = plan.actions().contains(name);
                if (isAction != tool.requiresApproval()) {
                    throw new IllegalStateException("Tool " + name + " is misplaced in the plan for " + category);
                }
            });
        }
    }

    private static Map<Category, CategoryPlan> defaultPlans() {
        var plans = new EnumMap<Category, CategoryPlan>(Category.class);
        plans.put(Category.TRACKING,
            CategoryPlan.of(Category.TRACKING, List.of("get_subscription", "track_package"), true));
        plans.put(Category.BILLING,
            CategoryPlan.of(Category.BILLING, List.of("get_subscription", "get_payment_history"), false));
        plans.put(Category.RETENTION, new CategoryPlan(Category.RETENTION,
            List.of("get_subscription", "get_customer_history"),
            List.of("cancel_subscription"), "cancel_subscription", false));
        plans.put(Category.DAMAGE_CLAIM, new CategoryPlan(Category.DAMAGE_CLAIM,
            List.of("get_subscription"),
            List.of("create_damage_claim"), "create_damage_claim", false));
        plans.put(Category.SUBSCRIPTION_CHANGE, new CategoryPlan(Category.SUBSCRIPTION_CHANGE,
            List.of("get_subscription"),
            List.of("pause_subscription", "skip_month", "change_frequency", "change_address"), null, false));
        plans.put(Category.GRATITUDE, CategoryPlan.of(Category.GRATITUDE, List.of(), true));
        plans.put(Category.GENERAL, CategoryPlan.of(Category.GENERAL, List.of("get_subscription"), false));
        plans.put(Category.UNCATEGORIZED, CategoryPlan.of(Category.UNCATEGORIZED, List.of(), false));
        return plans;
    }
}
