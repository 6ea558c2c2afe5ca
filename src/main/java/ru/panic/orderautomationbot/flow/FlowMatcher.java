package ru.panic.orderautomationbot.flow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.panic.orderautomationbot.model.LotBinding;
import ru.panic.orderautomationbot.repository.LotBindingRepository;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the flow for an order. Bindings are tried tier by tier: keywords against the description, then the
 * exact lot id, then the lot name pattern as a substring of the description. Within a tier the binding with the
 * lowest id wins. A binding without any criteria of its own matches on its flow's default keywords.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FlowMatcher {
    private static final TypeReference<List<String>> KEYWORDS_TYPE = new TypeReference<>() {
    };

    private final FlowRegistry flowRegistry;
    private final LotBindingRepository lotBindingRepository;
    private final ObjectMapper objectMapper;

    public Optional<FlowMatch> match(String description, Long lotId) {
        return match(description, lotId, lotBindingRepository.findAllOrderById());
    }

    public Optional<FlowMatch> match(String description, Long lotId, List<LotBinding> bindings) {
        String haystack = description == null ? "" : description.toLowerCase(Locale.ROOT);

        List<LotBinding> candidates = bindings.stream()
                .filter(binding -> flowRegistry.find(binding.getFlowId()).isPresent())
                .sorted((a, b) -> Long.compare(idOf(a), idOf(b)))
                .toList();

        for (LotBinding binding : candidates) {
            List<String> keywords = effectiveKeywords(binding);

            if (keywords.stream().anyMatch(keyword -> haystack.contains(keyword.toLowerCase(Locale.ROOT)))) {
                return Optional.of(toMatch(binding));
            }
        }

        if (lotId != null) {
            for (LotBinding binding : candidates) {
                if (Objects.equals(binding.getLotId(), lotId)) {
                    return Optional.of(toMatch(binding));
                }
            }
        }

        for (LotBinding binding : candidates) {
            String pattern = binding.getLotNamePattern();

            if (pattern != null && !pattern.isBlank() && haystack.contains(pattern.toLowerCase(Locale.ROOT))) {
                return Optional.of(toMatch(binding));
            }
        }

        return Optional.empty();
    }

    private List<String> effectiveKeywords(LotBinding binding) {
        List<String> keywords = parseKeywords(binding);

        if (!keywords.isEmpty()) {
            return keywords;
        }

        boolean hasLegacyCriteria = binding.getLotId() != null
                || (binding.getLotNamePattern() != null && !binding.getLotNamePattern().isBlank());

        if (hasLegacyCriteria) {
            return Collections.emptyList();
        }

        return flowRegistry.find(binding.getFlowId())
                .map(FlowDefinition::getKeywords)
                .orElse(Collections.emptyList());
    }

    private List<String> parseKeywords(LotBinding binding) {
        if (binding.getKeywords() == null || binding.getKeywords().isBlank()) {
            return Collections.emptyList();
        }

        try {
            List<String> keywords = objectMapper.readValue(binding.getKeywords(), KEYWORDS_TYPE);

            return keywords == null ? Collections.emptyList() : keywords.stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(keyword -> !keyword.isEmpty())
                    .toList();
        } catch (JsonProcessingException e) {
            log.warn("Malformed keywords of lot binding {}: {}", binding.getId(), e.getMessage());
            return Collections.emptyList();
        }
    }

    private static FlowMatch toMatch(LotBinding binding) {
        return new FlowMatch(binding.getFlowId(), binding.getId());
    }

    private static long idOf(LotBinding binding) {
        return binding.getId() == null ? Long.MAX_VALUE : binding.getId();
    }
}
