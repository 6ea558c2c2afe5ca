package ru.panic.orderautomationbot.bot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.commands.scope.BotCommandScopeDefault;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import ru.panic.orderautomationbot.exception.MarketplaceApiException;
import ru.panic.orderautomationbot.model.Order;
import ru.panic.orderautomationbot.model.StatsSnapshot;
import ru.panic.orderautomationbot.property.TelegramBotProperty;
import ru.panic.orderautomationbot.repository.OrderRepository;
import ru.panic.orderautomationbot.repository.StatsSnapshotRepository;
import ru.panic.orderautomationbot.service.ListingCache;
import ru.panic.orderautomationbot.service.OrderActionService;
import ru.panic.orderautomationbot.service.ReconciliationService;
import ru.panic.orderautomationbot.service.StatsService;
import ru.panic.orderautomationbot.service.SupportEscalationService;
import ru.panic.orderautomationbot.service.SupportTicketResult;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Operator channel: notifications about orders and a handful of commands, answered only in the admin chat.
 */
@Component
@Slf4j
public class TelegramBot extends TelegramLongPollingBot {
    private static final int MAX_MESSAGE_LENGTH = 4096;
    private static final int ORDERS_PAGE_SIZE = 10;
    private static final String LOTS_ELLIPSIS = "…";
    private static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("dd.MM.yy в HH:mm");

    private final TelegramBotProperty telegramBotProperty;
    private final OrderRepository orderRepository;
    private final StatsSnapshotRepository statsSnapshotRepository;
    private final StatsService statsService;
    private final ListingCache listingCache;
    private final OrderActionService orderActionService;
    private final ReconciliationService reconciliationService;
    private final SupportEscalationService supportEscalationService;
    private final ExecutorService executorService;

    public TelegramBot(TelegramBotProperty telegramBotProperty, OrderRepository orderRepository, StatsSnapshotRepository statsSnapshotRepository, StatsService statsService, ListingCache listingCache, OrderActionService orderActionService, @Lazy ReconciliationService reconciliationService, @Lazy SupportEscalationService supportEscalationService, ExecutorService executorService) {
        this.telegramBotProperty = telegramBotProperty;
        this.orderRepository = orderRepository;
        this.statsSnapshotRepository = statsSnapshotRepository;
        this.statsService = statsService;
        this.listingCache = listingCache;
        this.orderActionService = orderActionService;
        this.reconciliationService = reconciliationService;
        this.supportEscalationService = supportEscalationService;
        this.executorService = executorService;

        List<BotCommand> listOfCommands = new ArrayList<>();

        listOfCommands.add(new BotCommand("/start", "🔄 Перезапустить"));
        listOfCommands.add(new BotCommand("/orders", "📦 Последние заказы"));
        listOfCommands.add(new BotCommand("/stats", "📊 Статистика"));
        listOfCommands.add(new BotCommand("/sync", "🔁 Синхронизировать заказы"));
        listOfCommands.add(new BotCommand("/lots", "📋 Мои лоты"));
        listOfCommands.add(new BotCommand("/take", "🥮 Взять заказ в работу"));
        listOfCommands.add(new BotCommand("/done", "🦊 Заказ выполнен"));
        listOfCommands.add(new BotCommand("/refund", "❌ Возврат по заказу"));
        listOfCommands.add(new BotCommand("/ticket", "📨 Тикет на подтверждение"));

        try {
            execute(new SetMyCommands(listOfCommands, new BotCommandScopeDefault(), null));
        } catch (TelegramApiException e) {
            log.warn(e.getMessage());
        }
    }

    @Override
    public String getBotToken() {
        return telegramBotProperty.getApiKey();
    }

    @Override
    public String getBotUsername() {
        return telegramBotProperty.getBotUsername();
    }

    @Override
    public void onUpdateReceived(Update update) {
        executorService.submit(() -> {
            if (!update.hasMessage() || !update.getMessage().hasText()) {
                return;
            }

            long chatId = update.getMessage().getChatId();
            String text = update.getMessage().getText().trim();

            if (telegramBotProperty.getAdminChatId() == null || chatId != telegramBotProperty.getAdminChatId()) {
                log.info("Ignoring message from chat {}", chatId);
                return;
            }

            String[] parts = text.split("\\s+");
            String command = parts[0].contains("@") ? parts[0].substring(0, parts[0].indexOf('@')) : parts[0];
            List<String> arguments = Arrays.asList(parts).subList(1, parts.length);

            switch (command) {
                case "/start" -> handleStartMessage(chatId);
                case "/orders" -> handleOrdersMessage(chatId);
                case "/stats" -> handleStatsMessage(chatId);
                case "/sync" -> handleSyncMessage(chatId);
                case "/lots" -> handleLotsMessage(chatId);
                case "/take" -> handleOrderActionMessage(chatId, arguments, orderActionService::start,
                        "🥮 Заказ #%s взят в работу");
                case "/done" -> handleOrderActionMessage(chatId, arguments, orderActionService::complete,
                        "🦊 Заказ #%s выполнен");
                case "/refund" -> handleOrderActionMessage(chatId, arguments, orderActionService::refund,
                        "❌ Возврат по заказу #%s выполнен");
                case "/ticket" -> handleTicketMessage(chatId, arguments);
                default -> handleSendTextMessage(SendMessage.builder()
                        .chatId(chatId)
                        .text("❓ <b>Неизвестная команда</b>")
                        .parseMode("html")
                        .build());
            }
        });
    }

    /**
     * Sends a plain text notification to the admin chat. Failures are logged.
     */
    public void notifyOperator(String text) {
        if (telegramBotProperty.getAdminChatId() == null) {
            log.warn("Admin chat is not configured, notification dropped");
            return;
        }

        handleSendTextMessage(SendMessage.builder()
                .chatId(telegramBotProperty.getAdminChatId())
                .text(text.length() > MAX_MESSAGE_LENGTH ? text.substring(0, MAX_MESSAGE_LENGTH) : text)
                .build());
    }

    private void handleStartMessage(long chatId) {
        handleSendTextMessage(SendMessage.builder()
                .chatId(chatId)
                .text("👋 <b>Бот автоматизации заказов</b>\n\n"
                        + "/orders — последние заказы\n"
                        + "/stats — статистика\n"
                        + "/sync — синхронизировать заказы\n"
                        + "/lots — мои лоты\n"
                        + "/take &lt;id&gt; — взять заказ в работу\n"
                        + "/done &lt;id&gt; — заказ выполнен\n"
                        + "/refund &lt;id&gt; — возврат\n"
                        + "/ticket &lt;id&gt; [id...] — тикет на подтверждение")
                .parseMode("html")
                .build());
    }

    private void handleOrdersMessage(long chatId) {
        List<Order> orders = orderRepository.findLatest(ORDERS_PAGE_SIZE);

        if (orders.isEmpty()) {
            handleSendTextMessage(SendMessage.builder()
                    .chatId(chatId)
                    .text("📦 <b>Заказов пока нет</b>")
                    .parseMode("html")
                    .build());
            return;
        }

        StringBuilder text = new StringBuilder("📦 <b>Последние заказы</b>\n\n");

        for (Order order : orders) {
            text.append("<b>#").append(order.getMarketplaceOrderId()).append("</b> ")
                    .append("<code>").append(order.getStatus()).append("</code>\n")
                    .append(escape(order.getDescription())).append("\n")
                    .append(escape(order.getBuyerUsername())).append(", ")
                    .append(order.getPrice()).append(" ").append(escape(order.getCurrency())).append(", ")
                    .append(formatDateTime(order.getCreatedAt())).append("\n\n");
        }

        handleSendTextMessage(SendMessage.builder()
                .chatId(chatId)
                .text(text.toString())
                .parseMode("html")
                .build());
    }

    private void handleStatsMessage(long chatId) {
        Optional<StatsSnapshot> snapshot = statsSnapshotRepository.findLatest();

        String balance = snapshot
                .filter(stats -> stats.getBalance() != null)
                .map(stats -> stats.getBalance() + " " + stats.getCurrency() + " (на " + formatDateTime(stats.getCreatedAt()) + ")")
                .orElse("нет данных");

        handleSendTextMessage(SendMessage.builder()
                .chatId(chatId)
                .text("📊 <b>Статистика</b>\n\n"
                        + "📦 <b>Всего заказов:</b> <code>" + statsService.countOrders() + "</code>\n"
                        + "⏳ <b>Активных:</b> <code>" + statsService.countActiveOrders() + "</code>\n"
                        + "💳 <b>Баланс:</b> <code>" + escape(balance) + "</code>")
                .parseMode("html")
                .build());
    }

    private void handleSyncMessage(long chatId) {
        int created = reconciliationService.reconcile();

        handleSendTextMessage(SendMessage.builder()
                .chatId(chatId)
                .text("🔁 <b>Синхронизация завершена</b>\n\n"
                        + "Добавлено заказов: <code>" + created + "</code>")
                .parseMode("html")
                .build());
    }

    private void handleLotsMessage(long chatId) {
        List<ListingCache.CategoryListing> listings;

        try {
            listings = listingCache.get();
        } catch (MarketplaceApiException e) {
            log.warn(e.getMessage());
            handleSendTextMessage(SendMessage.builder()
                    .chatId(chatId)
                    .text("⚠️ <b>Не удалось загрузить лоты</b>")
                    .parseMode("html")
                    .build());
            return;
        }

        handleSendTextMessage(SendMessage.builder()
                .chatId(chatId)
                .text(formatLots(listings))
                .parseMode("html")
                .build());
    }

    /**
     * Whole lines only, so the html markup stays balanced when the list does not fit into one message.
     */
    static String formatLots(List<ListingCache.CategoryListing> listings) {
        List<String> lines = new ArrayList<>();

        for (ListingCache.CategoryListing listing : listings) {
            if (listing.lotCount() == 0) {
                continue;
            }

            lines.add("<b>" + escape(listing.getCategory().getName()) + "</b>\n");
            listing.getLotsBySubcategory().values().forEach(lots -> lots.forEach(lot -> lines.add(
                    "• <code>" + lot.getId() + "</code> " + escape(lot.getDescription()) + "\n")));
            lines.add("\n");
        }

        StringBuilder text = new StringBuilder("📋 <b>Мои лоты</b>\n\n");

        for (String line : lines) {
            if (text.length() + line.length() > MAX_MESSAGE_LENGTH - LOTS_ELLIPSIS.length()) {
                text.append(LOTS_ELLIPSIS);
                break;
            }
            text.append(line);
        }

        return text.toString();
    }

    private void handleOrderActionMessage(long chatId, List<String> arguments, Function<String, Optional<Order>> action, String doneTemplate) {
        if (arguments.size() != 1) {
            handleSendTextMessage(SendMessage.builder()
                    .chatId(chatId)
                    .text("❓ <b>Укажите номер заказа</b>")
                    .parseMode("html")
                    .build());
            return;
        }

        String orderId = stripHash(arguments.get(0));
        String reply;

        try {
            reply = action.apply(orderId)
                    .map(order -> String.format(doneTemplate, order.getMarketplaceOrderId()))
                    .orElse("❓ Заказ #" + orderId + " не найден");
        } catch (MarketplaceApiException e) {
            log.warn(e.getMessage());
            reply = "⚠️ Ошибка: " + e.getMessage();
        }

        handleSendTextMessage(SendMessage.builder()
                .chatId(chatId)
                .text(escape(reply))
                .parseMode("html")
                .build());
    }

    private void handleTicketMessage(long chatId, List<String> arguments) {
        if (arguments.isEmpty()) {
            handleSendTextMessage(SendMessage.builder()
                    .chatId(chatId)
                    .text("❓ <b>Укажите номера заказов</b>")
                    .parseMode("html")
                    .build());
            return;
        }

        SupportTicketResult result = arguments.size() == 1
                ? supportEscalationService.escalateManually(stripHash(arguments.get(0)))
                : supportEscalationService.escalate(arguments.stream().map(TelegramBot::stripHash).toList());

        if (result.isSuccess()) {
            handleSendTextMessage(SendMessage.builder()
                    .chatId(chatId)
                    .text("📨 <b>Тикет отправлен</b>"
                            + (result.getTicketId().isEmpty() ? "" : " <code>#" + escape(result.getTicketId()) + "</code>"))
                    .parseMode("html")
                    .build());
        }
    }

    private void handleSendTextMessage(SendMessage message) {
        try {
            execute(message);
        } catch (TelegramApiException e) {
            log.warn(e.getMessage());
        }
    }

    private static String formatDateTime(Long epochMillis) {
        if (epochMillis == null) {
            return "";
        }

        return LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneId.systemDefault())
                .format(DATE_TIME_FORMATTER);
    }

    private static String stripHash(String orderId) {
        return orderId.startsWith("#") ? orderId.substring(1) : orderId;
    }

    private static String escape(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text);
    }
}
