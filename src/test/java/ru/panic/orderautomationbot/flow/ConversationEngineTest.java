package ru.panic.orderautomationbot.flow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConversationEngine Unit Tests")
class ConversationEngineTest {
    private final ConversationEngine engine = new ConversationEngine();
    private final FlowRegistry registry = new FlowRegistry();

    private FlowDefinition flow(String id) {
        return registry.find(id).orElseThrow();
    }

    @Nested
    @DisplayName("Spotify flow")
    class SpotifyFlowTests {

        @Test
        @DisplayName("should walk email, password and confirm to done")
        void shouldCollectEmailAndPassword() {
            // Arrange
            FlowDefinition spotify = flow(FlowRegistry.SPOTIFY);

            // Act
            FlowResponse started = engine.start(spotify, Collections.emptyMap());
            FlowResponse afterEmail = engine.step(spotify, started.getNewState(), "user@mail.com", Collections.emptyMap());
            FlowResponse afterPassword = engine.step(spotify, afterEmail.getNewState(), "secret", Collections.emptyMap());
            FlowResponse confirmed = engine.step(spotify, afterPassword.getNewState(), "+", Collections.emptyMap());

            // Assert
            assertThat(started.getNewState().getStep()).isEqualTo("wait_email");
            assertThat(afterEmail.getNewState().getStep()).isEqualTo("wait_password");
            assertThat(afterPassword.getNewState().getStep()).isEqualTo(ConversationEngine.STEP_CONFIRM);
            assertThat(afterPassword.getMessage().resolve("ru")).contains("user@mail.com", "secret");
            assertThat(confirmed.isFinished()).isTrue();
            assertThat(confirmed.getNewState().getStep()).isEqualTo(ConversationEngine.STEP_DONE);
            assertThat(confirmed.getNewState().getData())
                    .containsEntry("email", "user@mail.com")
                    .containsEntry("password", "secret");
        }

        @Test
        @DisplayName("should stay on the email step when the input is not an email")
        void shouldRejectInvalidEmail() {
            // Arrange
            FlowDefinition spotify = flow(FlowRegistry.SPOTIFY);
            FlowState state = engine.start(spotify, Collections.emptyMap()).getNewState();

            // Act
            FlowResponse response = engine.step(spotify, state, "not-an-email", Collections.emptyMap());

            // Assert
            assertThat(response.isFinished()).isFalse();
            assertThat(response.getNewState().getStep()).isEqualTo("wait_email");
            assertThat(response.getNewState().getData()).isEmpty();
            assertThat(response.getMessage().resolve("en")).contains("example@example.com");
        }

        @Test
        @DisplayName("should restart from the first step on reject")
        void shouldRestartOnReject() {
            // Arrange
            FlowDefinition spotify = flow(FlowRegistry.SPOTIFY);
            Map<String, String> data = new LinkedHashMap<>();
            data.put("email", "user@mail.com");
            data.put("password", "secret");

            // Act
            FlowResponse response = engine.step(spotify, new FlowState(ConversationEngine.STEP_CONFIRM, data), "-", Collections.emptyMap());

            // Assert
            assertThat(response.isFinished()).isFalse();
            assertThat(response.getNewState().getStep()).isEqualTo("wait_email");
            assertThat(response.getNewState().getData()).isEmpty();
        }

        @Test
        @DisplayName("should ask again for + or - on any other confirm input")
        void shouldRepeatConfirmPrompt() {
            // Arrange
            FlowDefinition spotify = flow(FlowRegistry.SPOTIFY);
            FlowState state = new FlowState(ConversationEngine.STEP_CONFIRM, new LinkedHashMap<>(Map.of("email", "a@b.co")));

            // Act
            FlowResponse response = engine.step(spotify, state, "yes", Collections.emptyMap());

            // Assert
            assertThat(response.getNewState().getStep()).isEqualTo(ConversationEngine.STEP_CONFIRM);
            assertThat(response.getMessage()).isEqualTo(ConversationEngine.CONFIRM_RETRY);
        }
    }

    @Test
    @DisplayName("should answer with the waiting text once the flow is done")
    void shouldAnswerWaitingWhenDone() {
        // Arrange
        FlowDefinition spotify = flow(FlowRegistry.SPOTIFY);

        // Act
        FlowResponse response = engine.step(spotify, new FlowState(ConversationEngine.STEP_DONE, new LinkedHashMap<>()), "hello", Collections.emptyMap());

        // Assert
        assertThat(response.isFinished()).isFalse();
        assertThat(response.getMessage()).isEqualTo(ConversationEngine.WAITING);
    }

    @Test
    @DisplayName("should skip the optional 2FA step on the skip token")
    void shouldSkipOptionalStep() {
        // Arrange
        FlowDefinition discord = flow(FlowRegistry.DISCORD_NITRO);
        Map<String, String> data = new LinkedHashMap<>();
        data.put("email", "user@mail.com");
        data.put("password", "secret");

        // Act
        FlowResponse response = engine.step(discord, new FlowState("wait_2fa", data), "No", Collections.emptyMap());

        // Assert
        assertThat(response.getNewState().getStep()).isEqualTo(ConversationEngine.STEP_CONFIRM);
        assertThat(response.getNewState().getData()).doesNotContainKey("2fa_code");
        assertThat(response.getMessage().resolve("en")).contains("2FA: no");
        assertThat(response.getMessage().resolve("ru")).contains("2FA: нет");
    }

    @Test
    @DisplayName("should normalize the telegram username with a leading @")
    void shouldNormalizeUsername() {
        // Arrange
        FlowDefinition stars = flow(FlowRegistry.TELEGRAM_STARS);
        FlowState state = engine.start(stars, Collections.emptyMap()).getNewState();

        // Act
        FlowResponse response = engine.step(stars, state, "durov", Collections.emptyMap());

        // Assert
        assertThat(response.getNewState().getData()).containsEntry("username", "@durov");
        assertThat(response.getNewState().getStep()).isEqualTo(ConversationEngine.STEP_CONFIRM);
    }

    @Test
    @DisplayName("should prefer lot binding texts over the built-in ones")
    void shouldUseOverrides() {
        // Arrange
        FlowDefinition spotify = flow(FlowRegistry.SPOTIFY);
        Map<String, LocalizedMessage> overrides = Map.of("wait_email", LocalizedMessage.of("Почту, пожалуйста", null));

        // Act
        FlowResponse response = engine.start(spotify, overrides);

        // Assert
        assertThat(response.getMessage().resolve("ru")).isEqualTo("Почту, пожалуйста");
        assertThat(response.getMessage().resolve("en")).contains("Spotify");
    }

    @Test
    @DisplayName("should not mutate the state passed in")
    void shouldNotMutateInputState() {
        // Arrange
        FlowDefinition spotify = flow(FlowRegistry.SPOTIFY);
        FlowState state = new FlowState("wait_email", new LinkedHashMap<>());

        // Act
        engine.step(spotify, state, "user@mail.com", Collections.emptyMap());

        // Assert
        assertThat(state.getStep()).isEqualTo("wait_email");
        assertThat(state.getData()).isEmpty();
    }
}
