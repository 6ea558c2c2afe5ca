package ru.panic.orderautomationbot.api.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Session data read from the account page. {@code csrfToken} and {@code sessionId} are needed by every POST.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunPayAccountInfo {
    private Long userId;

    private String username;

    private String csrfToken;

    private String sessionId;

    private String locale;

    private Double balance;

    private String currency;
}
