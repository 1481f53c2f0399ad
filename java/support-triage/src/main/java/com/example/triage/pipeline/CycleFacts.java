package com.example.triage.pipeline;

import java.util.List;

import com.example.triage.model.ClassificationResult;
import com.example.triage.model.SafetySignal;
import com.example.triage.model.ToolExecution;
import com.example.triage.tools.CategoryPlan;

/**
 * Everything the decision policy looks at for one cycle. {@code classification} is null when
 * classification was skipped or failed; {@code plan} is null in that case too.
 */
public record CycleFacts(
    SafetySignal safety,
    boolean humanRequested,
    ClassificationResult classification,
    boolean classifierFailed,
    boolean priorCycle,
    CategoryPlan plan,
    List<ToolExecution> executions
) {

    public CycleFacts {
        executions = executions != null ? List.copyOf(executions) : List.of();
    }

    public static CycleFacts flagged(SafetySignal safety, boolean priorCycle) {
        return new CycleFacts(safety, false, null, false, priorCycle, null, List.of());
    }
}
