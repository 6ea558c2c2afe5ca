package ru.panic.orderautomationbot.flow;

import lombok.Value;

@Value
public class FlowMatch {
    String flowId;

    Long lotBindingId;
}
