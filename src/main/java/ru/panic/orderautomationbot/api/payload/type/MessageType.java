package ru.panic.orderautomationbot.api.payload.type;

public enum MessageType {
    NON_SYSTEM,
    ORDER_CONFIRMED,
    NEW_FEEDBACK,
    FEEDBACK_CHANGED,
    OTHER
}
