package ru.panic.orderautomationbot.flow;

import java.util.Optional;

@FunctionalInterface
public interface InputValidator {
    /**
     * @param input trimmed buyer message
     * @return the value to store, or empty when the input is rejected
     */
    Optional<String> accept(String input);
}
