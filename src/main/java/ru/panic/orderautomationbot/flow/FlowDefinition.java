package ru.panic.orderautomationbot.flow;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Compiled conversational state machine for one product type. The input steps run in declaration order and are
 * followed by the {@link ConversationEngine#STEP_CONFIRM} step, which either finishes the flow or restarts it.
 */
@Value
@Builder
public class FlowDefinition {
    String id;

    String title;

    // matched against the order description when a binding declares no keywords of its own
    @Singular
    List<String> keywords;

    @Singular
    List<FlowStep> steps;

    // shown at the confirm step, {dataKey} placeholders are substituted
    LocalizedMessage summary;

    public FlowStep firstStep() {
        return steps.get(0);
    }

    public Optional<FlowStep> findStep(String name) {
        return steps.stream()
                .filter(step -> step.getName().equals(name))
                .findFirst();
    }

    public String nextStepName(String name) {
        for (int i = 0; i < steps.size() - 1; i++) {
            if (steps.get(i).getName().equals(name)) {
                return steps.get(i + 1).getName();
            }
        }
        return ConversationEngine.STEP_CONFIRM;
    }
}
