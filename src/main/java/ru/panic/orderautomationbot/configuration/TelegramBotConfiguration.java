package ru.panic.orderautomationbot.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;
import ru.panic.orderautomationbot.bot.TelegramBot;

@Configuration
@Slf4j
public class TelegramBotConfiguration {
    @Bean
    @ConditionalOnProperty(prefix = "telegram.bots", name = "api-key")
    public TelegramBotsApi telegramBotsApi(TelegramBot telegramBot) throws TelegramApiException {
        TelegramBotsApi telegramBotsApi = new TelegramBotsApi(DefaultBotSession.class);
        telegramBotsApi.registerBot(telegramBot);

        log.info("Telegram bot registered");
        return telegramBotsApi;
    }
}
