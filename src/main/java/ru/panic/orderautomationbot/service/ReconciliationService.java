package ru.panic.orderautomationbot.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.panic.orderautomationbot.api.FunPayApi;
import ru.panic.orderautomationbot.api.payload.FunPayOrderShortcut;
import ru.panic.orderautomationbot.api.payload.type.MarketplaceOrderStatus;
import ru.panic.orderautomationbot.bot.TelegramBot;
import ru.panic.orderautomationbot.exception.MarketplaceApiException;
import ru.panic.orderautomationbot.flow.FlowMatch;
import ru.panic.orderautomationbot.flow.FlowMatcher;
import ru.panic.orderautomationbot.model.type.OrderStatus;
import ru.panic.orderautomationbot.property.FunPayProperty;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Inserts every sale the marketplace knows about and the local store does not. Sends nothing to buyers.
 */
@Service
@Slf4j
public class ReconciliationService {
    private final FunPayApi funPayApi;
    private final OrderService orderService;
    private final FlowMatcher flowMatcher;
    private final LanguageDetector languageDetector;
    private final TelegramBot telegramBot;
    private final FunPayProperty funPayProperty;

    public ReconciliationService(FunPayApi funPayApi, OrderService orderService, FlowMatcher flowMatcher, LanguageDetector languageDetector, TelegramBot telegramBot, FunPayProperty funPayProperty) {
        this.funPayApi = funPayApi;
        this.orderService = orderService;
        this.flowMatcher = flowMatcher;
        this.languageDetector = languageDetector;
        this.telegramBot = telegramBot;
        this.funPayProperty = funPayProperty;
    }

    /**
     * @return the number of orders created, 0 on a rerun or when the sales list could not be read
     */
    public int reconcile() {
        log.info("Reconciling orders with the marketplace");

        List<FunPayOrderShortcut> sales;

        try {
            sales = funPayApi.getSales(EnumSet.allOf(MarketplaceOrderStatus.class), funPayProperty.getSalesPageLimit());
        } catch (MarketplaceApiException e) {
            log.error("Reconciliation failed to read sales", e);
            telegramBot.notifyOperator("⚠️ Синхронизация заказов не удалась: " + e.getMessage());
            return 0;
        }

        int created = 0;

        for (FunPayOrderShortcut sale : sales) {
            if (orderService.findByMarketplaceOrderId(sale.getId()).isPresent()) {
                continue;
            }

            Optional<FlowMatch> flowMatch = flowMatcher.match(sale.getDescription(), sale.getLotId());
            OrderStatus status = switch (sale.getStatus()) {
                case PAID -> flowMatch.isPresent() ? OrderStatus.AWAITING_DATA : OrderStatus.DATA_COLLECTED;
                case CLOSED -> OrderStatus.CONFIRMED;
                case REFUNDED -> OrderStatus.REFUNDED;
            };

            if (orderService.createIfAbsent(sale, flowMatch.orElse(null), languageDetector.detect(sale.getDescription()), status)) {
                created++;
            }
        }

        if (created > 0) {
            log.info("Reconciled {} orders", created);
        } else {
            log.info("No orders to reconcile");
        }

        return created;
    }
}
