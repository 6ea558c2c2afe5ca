package ru.panic.orderautomationbot.property;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "funpay")
@Getter
@Setter
public class FunPayProperty {
    private String goldenKey;

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private String baseUrl = "https://funpay.com";

    private String supportBaseUrl = "https://support.funpay.com";

    private long eventPollDelayMillis = 6000;

    private int salesPageLimit = 20;

    private long ratingSettleDelayMillis = 3000;

    private int connectTimeoutMillis = 5000;

    private int readTimeoutMillis = 20000;
}
