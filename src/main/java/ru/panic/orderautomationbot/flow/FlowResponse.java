package ru.panic.orderautomationbot.flow;

import lombok.Value;

@Value
public class FlowResponse {
    FlowState newState;

    LocalizedMessage message;

    boolean finished;
}
