package ru.panic.orderautomationbot.property;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "automation")
@Getter
@Setter
public class AutomationProperty {
    private boolean reconcileOnStartup = true;

    private int supportAttempts = 3;

    private long supportBackoffMillis = 2000;

    private long listingCacheTtlSeconds = 3600;

    private int reviewReminderBatchSize = 50;
}
