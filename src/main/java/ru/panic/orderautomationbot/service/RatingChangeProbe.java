package ru.panic.orderautomationbot.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.panic.orderautomationbot.api.FunPayApi;
import ru.panic.orderautomationbot.bot.TelegramBot;
import ru.panic.orderautomationbot.exception.MarketplaceApiException;
import ru.panic.orderautomationbot.property.FunPayProperty;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * On a feedback notice, reads the seller rating twice with a settle delay in between and tells the operator
 * when it moved.
 */
@Component
@Slf4j
public class RatingChangeProbe {
    private static final Pattern ORDER_ID_PATTERN = Pattern.compile("#([A-Z0-9]{8})");

    private final FunPayApi funPayApi;
    private final TelegramBot telegramBot;
    private final ExecutorService executorService;
    private final FunPayProperty funPayProperty;

    public RatingChangeProbe(FunPayApi funPayApi, TelegramBot telegramBot, ExecutorService executorService, FunPayProperty funPayProperty) {
        this.funPayApi = funPayApi;
        this.telegramBot = telegramBot;
        this.executorService = executorService;
        this.funPayProperty = funPayProperty;
    }

    public void probeAsync(String noticeText) {
        executorService.submit(() -> probe(noticeText));
    }

    /**
     * @return whether the operator was notified
     */
    public boolean probe(String noticeText) {
        Optional<Double> before = readRating();

        try {
            Thread.sleep(funPayProperty.getRatingSettleDelayMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }

        Optional<Double> after = readRating();

        if (before.isEmpty() || after.isEmpty() || Objects.equals(before.get(), after.get())) {
            return false;
        }

        telegramBot.notifyOperator("⭐ Изменился рейтинг! Был " + before.get() + ", стал " + after.get() + "\n"
                + "Заказ #" + orderIdOf(noticeText));
        return true;
    }

    static String orderIdOf(String noticeText) {
        Matcher matcher = ORDER_ID_PATTERN.matcher(noticeText == null ? "" : noticeText);

        return matcher.find() ? matcher.group(1) : "?";
    }

    private Optional<Double> readRating() {
        try {
            return funPayApi.getRating();
        } catch (MarketplaceApiException e) {
            log.warn(e.getMessage());
            return Optional.empty();
        }
    }
}
