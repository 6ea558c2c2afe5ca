package ru.panic.orderautomationbot.flow;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.panic.orderautomationbot.model.LotBinding;
import ru.panic.orderautomationbot.repository.LotBindingRepository;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
@DisplayName("FlowMatcher Unit Tests")
class FlowMatcherTest {
    @Mock
    private LotBindingRepository lotBindingRepository;

    private FlowMatcher flowMatcher;

    @BeforeEach
    void setUp() {
        flowMatcher = new FlowMatcher(new FlowRegistry(), lotBindingRepository, new ObjectMapper());
    }

    private static LotBinding binding(long id, String flowId, String keywords, Long lotId, String pattern) {
        return LotBinding.builder()
                .id(id)
                .flowId(flowId)
                .keywords(keywords)
                .lotId(lotId)
                .lotNamePattern(pattern)
                .build();
    }

    @Test
    @DisplayName("should match keywords case-insensitively before lot id")
    void shouldPreferKeywordsOverLotId() {
        // Arrange
        List<LotBinding> bindings = List.of(
                binding(1, FlowRegistry.CHATGPT, null, 555L, null),
                binding(2, FlowRegistry.SPOTIFY, "[\"spotify premium\"]", null, null));

        // Act
        Optional<FlowMatch> match = flowMatcher.match("SPOTIFY Premium 1 month", 555L, bindings);

        // Assert
        assertThat(match).contains(new FlowMatch(FlowRegistry.SPOTIFY, 2L));
    }

    @Test
    @DisplayName("should fall back to the exact lot id")
    void shouldMatchLotId() {
        // Arrange
        List<LotBinding> bindings = List.of(binding(7, FlowRegistry.CHATGPT, null, 555L, null));

        // Act
        Optional<FlowMatch> match = flowMatcher.match("Some subscription", 555L, bindings);

        // Assert
        assertThat(match).contains(new FlowMatch(FlowRegistry.CHATGPT, 7L));
    }

    @Test
    @DisplayName("should fall back to the lot name pattern")
    void shouldMatchPattern() {
        // Arrange
        List<LotBinding> bindings = List.of(binding(3, FlowRegistry.TELEGRAM_STARS, null, 1L, "звёзды"));

        // Act
        Optional<FlowMatch> match = flowMatcher.match("100 Звёзды для Telegram", 2L, bindings);

        // Assert
        assertThat(match).contains(new FlowMatch(FlowRegistry.TELEGRAM_STARS, 3L));
    }

    @Test
    @DisplayName("should pick the lowest id when several bindings match in one tier")
    void shouldPickLowestId() {
        // Arrange
        List<LotBinding> bindings = List.of(
                binding(9, FlowRegistry.CHATGPT, "[\"plus\"]", null, null),
                binding(4, FlowRegistry.SPOTIFY, "[\"plus\"]", null, null));

        // Act
        Optional<FlowMatch> match = flowMatcher.match("plus", null, bindings);

        // Assert
        assertThat(match.map(FlowMatch::getLotBindingId)).contains(4L);
    }

    @Test
    @DisplayName("should use the flow's own keywords for a binding without criteria")
    void shouldUseDefaultKeywords() {
        // Arrange
        List<LotBinding> bindings = List.of(binding(5, FlowRegistry.DISCORD_NITRO, null, null, null));

        // Act
        Optional<FlowMatch> match = flowMatcher.match("Discord Nitro 1 month", null, bindings);

        // Assert
        assertThat(match).contains(new FlowMatch(FlowRegistry.DISCORD_NITRO, 5L));
    }

    @Test
    @DisplayName("should ignore bindings of unknown flows and malformed keywords")
    void shouldIgnoreBrokenBindings() {
        // Arrange
        List<LotBinding> bindings = List.of(
                binding(1, "netflix", "[\"netflix\"]", null, null),
                binding(2, FlowRegistry.SPOTIFY, "not json", 10L, null));

        // Act
        Optional<FlowMatch> match = flowMatcher.match("netflix", null, bindings);

        // Assert
        assertThat(match).isEmpty();
    }

    @Test
    @DisplayName("should return empty when nothing matches")
    void shouldReturnEmpty() {
        // Act
        Optional<FlowMatch> match = flowMatcher.match("Steam wallet", 1L, List.of());

        // Assert
        assertThat(match).isEmpty();
    }
}
