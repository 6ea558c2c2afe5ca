package ru.panic.orderautomationbot.flow;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-order position in a flow, persisted as json in {@code orders_table.flow_state}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FlowState {
    private String step;

    private Map<String, String> data = new LinkedHashMap<>();

    public FlowState copy() {
        return new FlowState(step, data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data));
    }
}
