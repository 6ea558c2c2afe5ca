package ru.panic.orderautomationbot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.panic.orderautomationbot.api.FunPayApi;
import ru.panic.orderautomationbot.exception.MarketplaceApiException;
import ru.panic.orderautomationbot.flow.LocalizedMessage;

import java.util.Map;
import java.util.Optional;

/**
 * Outbound buyer chat messages. Sends are not retried, a failure is logged and reported as {@code false}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BuyerMessageService {
    public static final String ORDER_STARTED = "order_started";
    public static final String ORDER_COMPLETED = "order_completed";
    public static final String ORDER_CANCELLED = "order_cancelled";
    public static final String REVIEW_REMINDER = "review_reminder";

    private static final Map<String, LocalizedMessage> STATUS_MESSAGES = Map.of(
            ORDER_STARTED, LocalizedMessage.of(
                    "🥮 Продавец приступил к вашему заказу.\n"
                            + "Он будет выполнен (или отменен, если данные неверны) "
                            + "в ближайшее время (не более 20 минут)",
                    "🥮 The seller has started processing your order. "
                            + "It will be fulfilled (or canceled if the information is incorrect) "
                            + "shortly (no more than 20 minutes)."),
            ORDER_COMPLETED, LocalizedMessage.of(
                    "🦊 ЗАКАЗ ВЫПОЛНЕН! Не забудьте подтвердить заказ и оставить отзыв.",
                    "🦊 ORDER COMPLETED! Don't forget to confirm your order and leave a review."),
            ORDER_CANCELLED, LocalizedMessage.of(
                    "❌️ ЗАКАЗ ОТМЕНЕН! Возможно, вы указали неверные данные "
                            + "или продавец не может выполнить заказ в данный момент. Простите…",
                    "❌️ ORDER CANCELLED! You may have provided incorrect information "
                            + "or the seller is unable to fulfill your order at this time. Sorry..."),
            REVIEW_REMINDER, LocalizedMessage.of(
                    "🫶 Пожалуйста, поставьте нам 5 звезд ⭐️\n\n"
                            + "Продавец старается выполнять все заказы быстро и качественно, "
                            + "при этом сохраняя самую низкую цену на рынке.\n\n"
                            + "Если у вас возникли проблемы, не спешите портить рейтинг продавцу, "
                            + "обратитесь в чат к продавцу. Чаще всего, если что-то случится, "
                            + "мы бесплатно восстанавливаем подписку.",
                    "🫶 Please give us 5 stars ⭐️\n\n"
                            + "The seller strives to fulfill all orders quickly and efficiently, "
                            + "while maintaining the lowest prices on the market.\n\n"
                            + "If you encounter any problems, don't rush to ruin the seller's rating; "
                            + "contact them via chat. In most cases, if something happens, "
                            + "we will restore your subscription free of charge."));

    private final FunPayApi funPayApi;

    public static Optional<LocalizedMessage> statusMessage(String statusKey) {
        return Optional.ofNullable(STATUS_MESSAGES.get(statusKey));
    }

    public boolean send(String chatId, String text) {
        if (chatId == null || text == null || text.isBlank()) {
            return false;
        }

        try {
            funPayApi.sendMessage(chatId, text);
            return true;
        } catch (MarketplaceApiException e) {
            log.warn("Message to chat {} was not sent: {}", chatId, e.getMessage());
            return false;
        }
    }

    public boolean send(String chatId, LocalizedMessage message, String lang) {
        return send(chatId, message.resolve(lang));
    }

    public boolean sendStatusMessage(String chatId, String statusKey, String lang) {
        Optional<LocalizedMessage> message = statusMessage(statusKey);

        if (message.isEmpty()) {
            log.warn("Unknown status message {}", statusKey);
            return false;
        }

        return send(chatId, message.get(), lang);
    }
}
