package ru.panic.orderautomationbot.flow;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interprets a {@link FlowDefinition}: one buyer message in, the next state and the reply out.
 * Holds no state of its own.
 */
@Component
public class ConversationEngine {
    public static final String STEP_CONFIRM = "wait_confirm";
    public static final String STEP_DONE = "done";

    public static final String CONFIRM_TOKEN = "+";
    public static final String REJECT_TOKEN = "-";

    public static final String KEY_CONFIRM_RETRY = STEP_CONFIRM + "_retry";
    public static final String KEY_WAITING = "waiting";
    public static final String INVALID_SUFFIX = "_invalid";

    static final LocalizedMessage CONFIRM_RETRY = LocalizedMessage.of(
            "🍂 Напишите + если данные верны, или - если нет.",
            "🍂 Write + if the data is correct, or - if not.");

    static final LocalizedMessage DONE = LocalizedMessage.of(
            "🧡 Я передал данные продавцу!\n\n"
                    + "В ближайшее время он выполнит Ваш заказ (от 10 минут до 12 часов) и уведомит Вас.\n\n"
                    + "Если вы вдруг указали неверные данные, не переживайте. "
                    + "Когда продавец приступит к вашему заказу, он вернёт деньги.",
            "🧡 I've sent the information to the seller!\n\n"
                    + "They will process your order shortly (10 minutes to 12 hours) and notify you.\n\n"
                    + "If you entered incorrect information, don't worry. "
                    + "Once the seller processes your order, they will refund your money.");

    static final LocalizedMessage WAITING = LocalizedMessage.of(
            "⏳ Ожидайте, продавец скоро приступит к заказу.",
            "⏳ Please wait, the seller will process your order soon.");

    private static final LocalizedMessage MISSING_VALUE = LocalizedMessage.of("нет", "no");

    public FlowResponse start(FlowDefinition flow, Map<String, LocalizedMessage> overrides) {
        FlowStep first = flow.firstStep();

        return new FlowResponse(
                new FlowState(first.getName(), new LinkedHashMap<>()),
                message(overrides, first.getName(), first.getPrompt()),
                false);
    }

    public FlowResponse step(FlowDefinition flow, FlowState state, String input, Map<String, LocalizedMessage> overrides) {
        String text = input == null ? "" : input.trim();
        FlowState current = state == null ? new FlowState(flow.firstStep().getName(), new LinkedHashMap<>()) : state.copy();

        if (current.getStep() == null) {
            current.setStep(flow.firstStep().getName());
        }

        String stepName = current.getStep();

        if (STEP_DONE.equals(stepName)) {
            return new FlowResponse(current, message(overrides, KEY_WAITING, WAITING), false);
        }

        if (STEP_CONFIRM.equals(stepName)) {
            return handleConfirm(flow, current, text, overrides);
        }

        FlowStep step = flow.findStep(stepName).orElse(null);

        if (step == null) {
            return new FlowResponse(current, message(overrides, KEY_WAITING, WAITING), false);
        }

        Map<String, String> data = new LinkedHashMap<>(current.getData());

        if (step.isOptional() && step.isSkipToken(text)) {
            data.remove(step.getDataKey());
        } else {
            String value = step.getValidator().accept(text).orElse(null);

            if (value == null) {
                return new FlowResponse(current, message(overrides, step.getName() + INVALID_SUFFIX, step.getInvalid()), false);
            }
            data.put(step.getDataKey(), value);
        }

        return enter(flow, flow.nextStepName(stepName), data, overrides);
    }

    private FlowResponse handleConfirm(FlowDefinition flow, FlowState current, String text,
                                       Map<String, LocalizedMessage> overrides) {
        switch (text) {
            case CONFIRM_TOKEN -> {
                return new FlowResponse(
                        new FlowState(STEP_DONE, new LinkedHashMap<>(current.getData())),
                        message(overrides, STEP_DONE, DONE),
                        true);
            }
            case REJECT_TOKEN -> {
                return start(flow, overrides);
            }
            default -> {
                return new FlowResponse(current, message(overrides, KEY_CONFIRM_RETRY, CONFIRM_RETRY), false);
            }
        }
    }

    private FlowResponse enter(FlowDefinition flow, String stepName, Map<String, String> data,
                               Map<String, LocalizedMessage> overrides) {
        if (STEP_CONFIRM.equals(stepName)) {
            LocalizedMessage summary = message(overrides, STEP_CONFIRM, flow.getSummary());

            return new FlowResponse(new FlowState(STEP_CONFIRM, data), render(summary, flow, data), false);
        }

        FlowStep next = flow.findStep(stepName).orElseThrow();

        return new FlowResponse(new FlowState(stepName, data), message(overrides, stepName, next.getPrompt()), false);
    }

    private LocalizedMessage render(LocalizedMessage template, FlowDefinition flow, Map<String, String> data) {
        String ru = template.getRu();
        String en = template.getEn();

        for (FlowStep step : flow.getSteps()) {
            String placeholder = "{" + step.getDataKey() + "}";
            String value = data.get(step.getDataKey());

            ru = ru.replace(placeholder, value != null ? value : MISSING_VALUE.getRu());
            en = en.replace(placeholder, value != null ? value : MISSING_VALUE.getEn());
        }

        return LocalizedMessage.of(ru, en);
    }

    private LocalizedMessage message(Map<String, LocalizedMessage> overrides, String key, LocalizedMessage fallback) {
        LocalizedMessage override = overrides == null ? null : overrides.get(key);

        return override == null ? fallback : override.orElse(fallback);
    }
}
