package ru.panic.orderautomationbot.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.panic.orderautomationbot.api.FunPayApi;
import ru.panic.orderautomationbot.api.event.MarketplaceEvent;
import ru.panic.orderautomationbot.api.event.NewMessageEvent;
import ru.panic.orderautomationbot.api.event.NewOrderEvent;
import ru.panic.orderautomationbot.api.event.OrderStatusChangedEvent;
import ru.panic.orderautomationbot.api.payload.FunPayMessage;
import ru.panic.orderautomationbot.api.payload.FunPayOrderShortcut;
import ru.panic.orderautomationbot.api.payload.type.MarketplaceOrderStatus;
import ru.panic.orderautomationbot.api.payload.type.MessageType;
import ru.panic.orderautomationbot.bot.TelegramBot;
import ru.panic.orderautomationbot.exception.MarketplaceApiException;
import ru.panic.orderautomationbot.flow.FlowMatch;
import ru.panic.orderautomationbot.flow.FlowMatcher;
import ru.panic.orderautomationbot.model.AutomationSettings;
import ru.panic.orderautomationbot.model.Order;
import ru.panic.orderautomationbot.model.type.OrderStatus;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Routes one marketplace event to its handler. Called sequentially from the listener thread.
 */
@Service
@Slf4j
public class OrderEventHandler {
    public static final String CHAT_URL = "https://funpay.com/chat/?node=";

    private static final Pattern ORDER_ID_PATTERN = Pattern.compile("#([A-Z0-9]{8})");

    private final OrderService orderService;
    private final FlowService flowService;
    private final FlowMatcher flowMatcher;
    private final LanguageDetector languageDetector;
    private final BuyerMessageService buyerMessageService;
    private final ReviewReminderService reviewReminderService;
    private final AutomationSettingsService automationSettingsService;
    private final RatingChangeProbe ratingChangeProbe;
    private final FunPayApi funPayApi;
    private final TelegramBot telegramBot;

    public OrderEventHandler(OrderService orderService, FlowService flowService, FlowMatcher flowMatcher, LanguageDetector languageDetector, BuyerMessageService buyerMessageService, ReviewReminderService reviewReminderService, AutomationSettingsService automationSettingsService, RatingChangeProbe ratingChangeProbe, FunPayApi funPayApi, TelegramBot telegramBot) {
        this.orderService = orderService;
        this.flowService = flowService;
        this.flowMatcher = flowMatcher;
        this.languageDetector = languageDetector;
        this.buyerMessageService = buyerMessageService;
        this.reviewReminderService = reviewReminderService;
        this.automationSettingsService = automationSettingsService;
        this.ratingChangeProbe = ratingChangeProbe;
        this.funPayApi = funPayApi;
        this.telegramBot = telegramBot;
    }

    public void handleEvent(MarketplaceEvent event) {
        if (event instanceof NewOrderEvent newOrderEvent) {
            onNewOrder(newOrderEvent.getOrder());
        } else if (event instanceof OrderStatusChangedEvent orderStatusChangedEvent) {
            onOrderStatusChanged(orderStatusChangedEvent.getOrder());
        } else if (event instanceof NewMessageEvent newMessageEvent) {
            onNewMessage(newMessageEvent.getMessage());
        }
    }

    private void onNewOrder(FunPayOrderShortcut shortcut) {
        log.info("New order #{} from {}", shortcut.getId(), shortcut.getBuyerUsername());

        if (orderService.findByMarketplaceOrderId(shortcut.getId()).isPresent()) {
            return;
        }

        String buyerLang = resolveBuyerLang(shortcut);
        Optional<FlowMatch> flowMatch = flowMatcher.match(shortcut.getDescription(), shortcut.getLotId());
        OrderStatus status = flowMatch.isPresent() ? OrderStatus.AWAITING_DATA : OrderStatus.DATA_COLLECTED;

        if (!orderService.createIfAbsent(shortcut, flowMatch.orElse(null), buyerLang, status)) {
            return;
        }

        telegramBot.notifyOperator("🆕 Новый заказ #" + shortcut.getId() + "\n"
                + "Покупатель: " + shortcut.getBuyerUsername() + "\n"
                + "Товар: " + shortcut.getDescription() + "\n"
                + "Цена: " + shortcut.getPrice() + " " + shortcut.getCurrency() + "\n"
                + "Скрипт: " + flowMatch.map(FlowMatch::getFlowId).orElse("none"));

        if (flowMatch.isEmpty()) {
            return;
        }

        flowService.startFlow(shortcut.getId()).ifPresent(outcome -> {
            buyerMessageService.send(shortcut.getChatId(), outcome.getResponse().getMessage(), buyerLang);

            log.info("Flow {} started for order #{}", flowMatch.get().getFlowId(), shortcut.getId());
        });
    }

    private void onOrderStatusChanged(FunPayOrderShortcut shortcut) {
        log.info("Order #{} status changed: {}", shortcut.getId(), shortcut.getStatus());

        Optional<OrderStatusTransition> transition = orderService.applyMarketplaceStatus(shortcut.getId(), shortcut.getStatus());

        if (transition.isEmpty()) {
            return;
        }

        OrderStatusTransition applied = transition.get();

        if (shortcut.getStatus() == MarketplaceOrderStatus.CLOSED && applied.getCurrent() == OrderStatus.CONFIRMED) {
            AutomationSettings settings = automationSettingsService.get();

            if (Boolean.TRUE.equals(settings.getIsReviewReminder())) {
                reviewReminderService.schedule(shortcut.getId(), settings);
            }
        } else if (applied.getCurrent() == OrderStatus.DISPUTE && applied.isChanged()) {
            telegramBot.notifyOperator("⚠️ Заказ #" + shortcut.getId() + " открыт повторно (возможно спор)!\n"
                    + "Покупатель: " + shortcut.getBuyerUsername());
        }
    }

    private void onNewMessage(FunPayMessage message) {
        if (isOwnMessage(message) || message.isByBot()) {
            return;
        }

        if (message.getType() != null && message.getType() != MessageType.NON_SYSTEM) {
            onSystemMessage(message);
            return;
        }

        Optional<Order> awaitingOrder = orderService.findAwaitingData(message.getChatId(), message.getAuthorId());

        if (awaitingOrder.isEmpty()) {
            telegramBot.notifyOperator("💬 Сообщение от " + message.getAuthorName() + ":\n"
                    + message.getText() + "\n\n"
                    + CHAT_URL + message.getChatId());
            return;
        }

        Order order = awaitingOrder.get();

        flowService.advance(order.getMarketplaceOrderId(), message.getText()).ifPresent(outcome -> {
            buyerMessageService.send(order.getChatId(), outcome.getResponse().getMessage(), order.getBuyerLang());

            if (outcome.getResponse().isFinished()) {
                notifyDataCollected(outcome.getOrder(), outcome.getResponse().getNewState().getData());
            }
        });
    }

    private void onSystemMessage(FunPayMessage message) {
        if (message.getType() == MessageType.ORDER_CONFIRMED) {
            Matcher matcher = ORDER_ID_PATTERN.matcher(message.getText() == null ? "" : message.getText());

            // the reminder is scheduled by the CLOSED status event only
            if (matcher.find()) {
                orderService.applyMarketplaceStatus(matcher.group(1), MarketplaceOrderStatus.CLOSED);
            }
        } else if (message.getType() == MessageType.NEW_FEEDBACK || message.getType() == MessageType.FEEDBACK_CHANGED) {
            ratingChangeProbe.probeAsync(message.getText());
        }
    }

    private void notifyDataCollected(Order order, Map<String, String> data) {
        String fields = data.entrySet().stream()
                .map(entry -> "  " + entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining("\n"));

        telegramBot.notifyOperator("📥 Данные собраны для заказа #" + order.getMarketplaceOrderId() + "\n"
                + "Покупатель: " + order.getBuyerUsername() + "\n"
                + "Товар: " + order.getDescription() + "\n"
                + "Данные:\n" + fields);
    }

    private String resolveBuyerLang(FunPayOrderShortcut shortcut) {
        if (shortcut.getChatId() != null) {
            try {
                Optional<String> locale = funPayApi.getChatLocale(shortcut.getChatId());

                if (locale.isPresent()) {
                    return locale.get();
                }
            } catch (MarketplaceApiException e) {
                log.warn(e.getMessage());
            }
        }

        return languageDetector.detect(shortcut.getDescription());
    }

    private boolean isOwnMessage(FunPayMessage message) {
        try {
            return message.getAuthorId() != null && message.getAuthorId().equals(funPayApi.getAccount().getUserId());
        } catch (MarketplaceApiException e) {
            log.warn(e.getMessage());
            return false;
        }
    }
}
