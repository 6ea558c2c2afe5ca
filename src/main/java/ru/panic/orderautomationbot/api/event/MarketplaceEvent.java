package ru.panic.orderautomationbot.api.event;

/**
 * Marker for the typed events produced by {@link ru.panic.orderautomationbot.api.FunPayRunner}.
 */
public interface MarketplaceEvent {
}
