package ru.panic.orderautomationbot.flow;

import java.util.Optional;
import java.util.regex.Pattern;

public final class InputValidators {
    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[a-zA-Z0-9_.+-]{1,128}@[a-zA-Z0-9-]{1,128}\\.[a-zA-Z]{1,128}$");
    private static final Pattern PHONE_PATTERN = Pattern.compile("^\\+?\\d{7,15}$");
    private static final Pattern TELEGRAM_USERNAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_]{3,32}$");

    public static final InputValidator EMAIL = input ->
            EMAIL_PATTERN.matcher(input).matches() ? Optional.of(input) : Optional.empty();

    public static final InputValidator PHONE = input -> {
        String digits = input.replace(" ", "").replace("-", "");
        return PHONE_PATTERN.matcher(digits).matches() ? Optional.of(input) : Optional.empty();
    };

    // stored with a leading @ whether or not the buyer typed it
    public static final InputValidator TELEGRAM_USERNAME = input -> {
        String username = input.startsWith("@") ? input.substring(1) : input;
        return TELEGRAM_USERNAME_PATTERN.matcher(username).matches()
                ? Optional.of("@" + username)
                : Optional.empty();
    };

    public static final InputValidator ANY_TEXT = input ->
            input.isBlank() ? Optional.empty() : Optional.of(input);

    private InputValidators() {
    }
}
