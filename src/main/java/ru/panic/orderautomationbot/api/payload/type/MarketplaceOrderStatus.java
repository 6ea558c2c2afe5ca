package ru.panic.orderautomationbot.api.payload.type;

public enum MarketplaceOrderStatus {
    PAID,
    CLOSED,
    REFUNDED
}
