package ru.panic.orderautomationbot.service;

import org.springframework.stereotype.Component;
import ru.panic.orderautomationbot.flow.LocalizedMessage;

/**
 * Guesses the buyer's language from the order description when the chat page gives no locale.
 */
@Component
public class LanguageDetector {
    private static final double CYRILLIC_SHARE = 0.2;

    public String detect(String description) {
        if (description == null || description.isEmpty()) {
            return LocalizedMessage.LANG_RU;
        }

        long cyrillic = description.chars()
                .filter(c -> c >= '\u0400' && c <= '\u04FF')
                .count();

        if (cyrillic > description.length() * CYRILLIC_SHARE) {
            return LocalizedMessage.LANG_RU;
        }
        if (cyrillic == 0 && description.length() > 2) {
            return LocalizedMessage.LANG_EN;
        }
        return LocalizedMessage.LANG_RU;
    }
}
