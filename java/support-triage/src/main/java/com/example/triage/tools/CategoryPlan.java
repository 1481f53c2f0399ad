package com.example.triage.tools;

import java.util.List;

import com.example.triage.model.Category;

/**
 * What a category needs before it can be decided: read-only lookups to run, write actions
 * the classifier may pick from, and whether a confident reply may go out unattended.
 */
public record CategoryPlan(
    Category category,
    List<String> lookups,
    List<String> actions,
    String defaultAction,
    boolean autoSend
) {

    public CategoryPlan {
        lookups = List.copyOf(lookups);
        actions = List.copyOf(actions);
        if (defaultAction != null && !actions.contains(defaultAction)) {
            throw new IllegalArgumentException("Default action " + defaultAction + " not in " + actions);
        }
    }

    public static CategoryPlan of(Category category, List<String> lookups, boolean autoSend) {
        return new CategoryPlan(category, lookups, List.of(), null, autoSend);
    }

    /** The classifier's pick when this plan allows it, otherwise the default (which may be none). */
    public String actionFor(String requested) {
        if (requested != null && actions.contains(requested)) {
            return requested;
        }
        return defaultAction;
    }
}
