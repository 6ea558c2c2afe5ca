package ru.panic.orderautomationbot.api.event;

import lombok.Value;
import ru.panic.orderautomationbot.api.payload.FunPayOrderShortcut;

@Value
public class NewOrderEvent implements MarketplaceEvent {
    FunPayOrderShortcut order;
}
