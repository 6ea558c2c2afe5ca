package ru.panic.orderautomationbot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.panic.orderautomationbot.api.payload.FunPayOrderShortcut;
import ru.panic.orderautomationbot.api.payload.type.MarketplaceOrderStatus;
import ru.panic.orderautomationbot.flow.FlowMatch;
import ru.panic.orderautomationbot.model.Order;
import ru.panic.orderautomationbot.model.type.OrderStatus;
import ru.panic.orderautomationbot.repository.OrderRepository;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderService {
    private final OrderRepository orderRepository;

    public Optional<Order> findByMarketplaceOrderId(String marketplaceOrderId) {
        return orderRepository.findByMarketplaceOrderId(marketplaceOrderId);
    }

    /**
     * Inserts the order unless one with the same marketplace id exists. A racing insert that loses on the unique
     * constraint counts as "already exists". Not transactional: a failed insert must not poison a surrounding
     * transaction.
     *
     * @return whether a row was inserted
     */
    public boolean createIfAbsent(FunPayOrderShortcut shortcut, FlowMatch flowMatch, String buyerLang, OrderStatus status) {
        if (orderRepository.countByMarketplaceOrderId(shortcut.getId()) > 0) {
            return false;
        }

        long now = System.currentTimeMillis();

        Order order = Order.builder()
                .marketplaceOrderId(shortcut.getId())
                .buyerId(shortcut.getBuyerId())
                .buyerUsername(shortcut.getBuyerUsername())
                .chatId(shortcut.getChatId())
                .description(shortcut.getDescription() == null || shortcut.getDescription().isBlank()
                        ? "Unknown"
                        : shortcut.getDescription())
                .price(shortcut.getPrice())
                .currency(shortcut.getCurrency())
                .status(status)
                .flowId(flowMatch == null ? null : flowMatch.getFlowId())
                .lotBindingId(flowMatch == null ? null : flowMatch.getLotBindingId())
                .buyerLang(buyerLang)
                .createdAt(now)
                .updatedAt(now)
                .build();

        try {
            orderRepository.save(order);
            return true;
        } catch (DuplicateKeyException e) {
            log.info("Order #{} was inserted concurrently", shortcut.getId());
            return false;
        }
    }

    /**
     * Applies a marketplace status to the local order under a row lock. CLOSED confirms the order unless it was
     * refunded, REFUNDED always wins, PAID reopens a confirmed order as a dispute.
     */
    @Transactional
    public Optional<OrderStatusTransition> applyMarketplaceStatus(String marketplaceOrderId, MarketplaceOrderStatus status) {
        Optional<Order> lockedOrder = orderRepository.findByMarketplaceOrderIdForUpdate(marketplaceOrderId);

        if (lockedOrder.isEmpty()) {
            return Optional.empty();
        }

        Order order = lockedOrder.get();
        OrderStatus previous = order.getStatus();
        OrderStatus next = switch (status) {
            case CLOSED -> previous == OrderStatus.REFUNDED ? OrderStatus.REFUNDED : OrderStatus.CONFIRMED;
            case REFUNDED -> OrderStatus.REFUNDED;
            case PAID -> previous == OrderStatus.CONFIRMED ? OrderStatus.DISPUTE : previous;
        };

        if (next != previous) {
            order.setStatus(next);
            order.setUpdatedAt(System.currentTimeMillis());
            orderRepository.save(order);

            log.info("Order #{} status {} -> {}", marketplaceOrderId, previous, next);
        }

        return Optional.of(new OrderStatusTransition(order, previous, next));
    }

    @Transactional
    public Optional<Order> updateStatus(String marketplaceOrderId, OrderStatus status) {
        Optional<Order> lockedOrder = orderRepository.findByMarketplaceOrderIdForUpdate(marketplaceOrderId);

        lockedOrder.ifPresent(order -> {
            log.info("Order #{} status {} -> {}", marketplaceOrderId, order.getStatus(), status);

            order.setStatus(status);
            order.setUpdatedAt(System.currentTimeMillis());
            orderRepository.save(order);
        });

        return lockedOrder;
    }

    /**
     * Most recent order still collecting data in the chat, falling back to the buyer.
     */
    public Optional<Order> findAwaitingData(String chatId, Long buyerId) {
        Optional<Order> byChat = chatId == null
                ? Optional.empty()
                : orderRepository.findLatestByChatIdAndStatus(chatId, OrderStatus.AWAITING_DATA);

        if (byChat.isPresent() || buyerId == null) {
            return byChat;
        }

        return orderRepository.findLatestByBuyerIdAndStatus(buyerId, OrderStatus.AWAITING_DATA);
    }
}
