package ru.panic.orderautomationbot.api.event;

import lombok.Value;
import ru.panic.orderautomationbot.api.payload.FunPayMessage;

@Value
public class NewMessageEvent implements MarketplaceEvent {
    FunPayMessage message;
}
