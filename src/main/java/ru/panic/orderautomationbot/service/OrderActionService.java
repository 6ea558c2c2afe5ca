package ru.panic.orderautomationbot.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import ru.panic.orderautomationbot.api.FunPayApi;
import ru.panic.orderautomationbot.model.Order;
import ru.panic.orderautomationbot.model.type.OrderStatus;

import java.util.Optional;

/**
 * Operator actions on an order. Each one moves the status and tells the buyer.
 */
@Service
@RequiredArgsConstructor
public class OrderActionService {
    private final OrderService orderService;
    private final BuyerMessageService buyerMessageService;
    private final FunPayApi funPayApi;

    public Optional<Order> start(String marketplaceOrderId) {
        return transition(marketplaceOrderId, OrderStatus.IN_PROGRESS, BuyerMessageService.ORDER_STARTED);
    }

    public Optional<Order> complete(String marketplaceOrderId) {
        return transition(marketplaceOrderId, OrderStatus.COMPLETED, BuyerMessageService.ORDER_COMPLETED);
    }

    /**
     * Refunds on the marketplace first; the local status only changes when the refund went through.
     */
    public Optional<Order> refund(String marketplaceOrderId) {
        if (orderService.findByMarketplaceOrderId(marketplaceOrderId).isEmpty()) {
            return Optional.empty();
        }

        funPayApi.refund(marketplaceOrderId);

        return transition(marketplaceOrderId, OrderStatus.REFUNDED, BuyerMessageService.ORDER_CANCELLED);
    }

    private Optional<Order> transition(String marketplaceOrderId, OrderStatus status, String statusMessageKey) {
        Optional<Order> order = orderService.updateStatus(marketplaceOrderId, status);

        order.ifPresent(updated -> buyerMessageService.sendStatusMessage(updated.getChatId(), statusMessageKey, updated.getBuyerLang()));

        return order;
    }
}
