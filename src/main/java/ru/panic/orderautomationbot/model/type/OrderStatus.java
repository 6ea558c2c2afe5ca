package ru.panic.orderautomationbot.model.type;

public enum OrderStatus {
    AWAITING_DATA,
    DATA_COLLECTED,
    IN_PROGRESS,
    COMPLETED,
    REFUNDED,
    CONFIRMED,
    DISPUTE
}
