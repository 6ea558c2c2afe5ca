package ru.panic.orderautomationbot.flow;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Locale;
import java.util.Set;

@Value
@Builder
public class FlowStep {
    String name;

    // key under which the accepted value is stored
    String dataKey;

    InputValidator validator;

    // sent when the flow enters this step
    LocalizedMessage prompt;

    // sent when the validator rejects the input
    LocalizedMessage invalid;

    // inputs that leave the value unset and still advance, e.g. "no" for an optional 2FA code
    @Singular
    Set<String> skipTokens;

    public boolean isOptional() {
        return !skipTokens.isEmpty();
    }

    public boolean isSkipToken(String input) {
        return skipTokens.contains(input.toLowerCase(Locale.ROOT));
    }
}
