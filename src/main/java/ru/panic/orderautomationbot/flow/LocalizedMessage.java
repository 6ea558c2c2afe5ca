package ru.panic.orderautomationbot.flow;

import lombok.Value;

/**
 * A message in both supported languages.
 */
@Value
public class LocalizedMessage {
    public static final String LANG_RU = "ru";
    public static final String LANG_EN = "en";

    String ru;
    String en;

    public static LocalizedMessage of(String ru, String en) {
        return new LocalizedMessage(ru, en);
    }

    /**
     * Picks the variant for the buyer's language: {@code ru} gets the Russian text, any other tag the English
     * one. Falls back to the other variant when the preferred one is blank.
     */
    public String resolve(String lang) {
        boolean isRu = LANG_RU.equals(lang);
        String preferred = isRu ? ru : en;
        String other = isRu ? en : ru;

        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        return other == null ? "" : other;
    }

    public LocalizedMessage orElse(LocalizedMessage fallback) {
        return new LocalizedMessage(
                ru == null || ru.isBlank() ? fallback.getRu() : ru,
                en == null || en.isBlank() ? fallback.getEn() : en);
    }
}
