package ru.panic.orderautomationbot.api.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.panic.orderautomationbot.api.payload.type.MarketplaceOrderStatus;

/**
 * One row of the seller's sales list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunPayOrderShortcut {
    // eight characters, without the leading #
    private String id;

    private String description;

    private Double price;

    private String currency;

    private Long buyerId;

    private String buyerUsername;

    // "users-<min>-<max>"
    private String chatId;

    private MarketplaceOrderStatus status;

    // null when the sales row does not reference a lot
    private Long lotId;
}
