package ru.panic.orderautomationbot.property;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "telegram.bots")
@Getter
@Setter
public class TelegramBotProperty {
    private String apiKey;

    private String botUsername;

    // chat that receives operator notifications and may use the commands
    private Long adminChatId;
}
