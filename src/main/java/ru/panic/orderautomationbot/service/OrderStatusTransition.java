package ru.panic.orderautomationbot.service;

import lombok.Value;
import ru.panic.orderautomationbot.model.Order;
import ru.panic.orderautomationbot.model.type.OrderStatus;

@Value
public class OrderStatusTransition {
    Order order;

    OrderStatus previous;

    OrderStatus current;

    public boolean isChanged() {
        return previous != current;
    }
}
