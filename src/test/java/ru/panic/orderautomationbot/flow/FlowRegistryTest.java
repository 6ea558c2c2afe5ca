package ru.panic.orderautomationbot.flow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FlowRegistry Unit Tests")
class FlowRegistryTest {
    private final FlowRegistry registry = new FlowRegistry();
    private final ConversationEngine engine = new ConversationEngine();

    private static String validInput(FlowStep step) {
        if (step.isOptional()) {
            return step.getSkipTokens().iterator().next();
        }
        if (step.getValidator() == InputValidators.EMAIL) {
            return "buyer@mail.com";
        }
        if (step.getValidator() == InputValidators.PHONE) {
            return "+79991234567";
        }
        if (step.getValidator() == InputValidators.TELEGRAM_USERNAME) {
            return "@buyer_one";
        }
        return "secret";
    }

    @Test
    @DisplayName("should register the six product flows")
    void shouldRegisterFlows() {
        assertThat(registry.getAll()).extracting(FlowDefinition::getId).containsExactly(
                FlowRegistry.SPOTIFY,
                FlowRegistry.DISCORD_NITRO,
                FlowRegistry.CHATGPT,
                FlowRegistry.TELEGRAM_PREMIUM_1M,
                FlowRegistry.TELEGRAM_PREMIUM_LONG,
                FlowRegistry.TELEGRAM_STARS);
    }

    @Test
    @DisplayName("should give every flow a title, keywords and a summary naming each collected field")
    void shouldDefineCompleteFlows() {
        for (FlowDefinition flow : registry.getAll()) {
            assertThat(flow.getTitle()).isNotBlank();
            assertThat(flow.getKeywords()).isNotEmpty();
            assertThat(flow.getSteps()).isNotEmpty();

            for (FlowStep step : flow.getSteps()) {
                assertThat(step.getPrompt().getRu()).isNotBlank();
                assertThat(step.getPrompt().getEn()).isNotBlank();
                assertThat(flow.getSummary().getRu()).contains("{" + step.getDataKey() + "}");
                assertThat(flow.getSummary().getEn()).contains("{" + step.getDataKey() + "}");
            }
        }
    }

    @Test
    @DisplayName("should not find an unknown or missing flow id")
    void shouldNotFindUnknownFlow() {
        assertThat(registry.find("netflix")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    @DisplayName("should bring every flow to done through the confirm branch and keep the data on re-entry")
    void shouldFinishEveryFlow() {
        for (FlowDefinition flow : registry.getAll()) {
            // Arrange
            FlowResponse response = engine.start(flow, Map.of());
            int turns = 0;

            // Act
            while (!response.isFinished() && turns <= flow.getSteps().size()) {
                FlowState state = response.getNewState();
                String input = ConversationEngine.STEP_CONFIRM.equals(state.getStep())
                        ? ConversationEngine.CONFIRM_TOKEN
                        : validInput(flow.findStep(state.getStep()).orElseThrow());

                response = engine.step(flow, state, input, Map.of());
                turns++;
            }
            FlowResponse repeated = engine.step(flow, response.getNewState(), "anything", Map.of());

            // Assert
            assertThat(response.isFinished()).as(flow.getId()).isTrue();
            assertThat(response.getNewState().getStep()).as(flow.getId()).isEqualTo(ConversationEngine.STEP_DONE);
            assertThat(turns).as(flow.getId()).isLessThanOrEqualTo(flow.getSteps().size() + 1);
            assertThat(repeated.isFinished()).as(flow.getId()).isFalse();
            assertThat(repeated.getNewState().getStep()).as(flow.getId()).isEqualTo(ConversationEngine.STEP_DONE);
            assertThat(repeated.getNewState().getData()).as(flow.getId()).isEqualTo(response.getNewState().getData());
        }
    }
}
