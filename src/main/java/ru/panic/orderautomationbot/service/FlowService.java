package ru.panic.orderautomationbot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.panic.orderautomationbot.flow.ConversationEngine;
import ru.panic.orderautomationbot.flow.FlowDefinition;
import ru.panic.orderautomationbot.flow.FlowRegistry;
import ru.panic.orderautomationbot.flow.FlowResponse;
import ru.panic.orderautomationbot.flow.FlowState;
import ru.panic.orderautomationbot.flow.LocalizedMessage;
import ru.panic.orderautomationbot.model.Order;
import ru.panic.orderautomationbot.model.type.OrderStatus;
import ru.panic.orderautomationbot.repository.LotBindingRepository;
import ru.panic.orderautomationbot.repository.OrderRepository;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the {@link ConversationEngine} against persisted orders. Each call reads the order under a row lock,
 * advances the flow and writes the new state in the same transaction. Sending the reply is left to the caller,
 * after commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlowService {
    private static final TypeReference<Map<String, Map<String, String>>> OVERRIDES_TYPE = new TypeReference<>() {
    };

    private final OrderRepository orderRepository;
    private final LotBindingRepository lotBindingRepository;
    private final FlowRegistry flowRegistry;
    private final ConversationEngine conversationEngine;
    private final ObjectMapper objectMapper;

    @Transactional
    public Optional<FlowOutcome> startFlow(String marketplaceOrderId) {
        Order order = orderRepository.findByMarketplaceOrderIdForUpdate(marketplaceOrderId).orElse(null);

        if (order == null || order.getStatus() != OrderStatus.AWAITING_DATA) {
            return Optional.empty();
        }

        FlowDefinition flow = flowRegistry.find(order.getFlowId()).orElse(null);

        if (flow == null) {
            log.warn("Order #{} refers to unknown flow {}", marketplaceOrderId, order.getFlowId());
            return Optional.empty();
        }

        FlowResponse response = conversationEngine.start(flow, loadOverrides(order.getLotBindingId()));

        order.setFlowState(writeJson(response.getNewState()));
        order.setUpdatedAt(System.currentTimeMillis());
        orderRepository.save(order);

        return Optional.of(new FlowOutcome(order, response));
    }

    /**
     * Feeds one buyer message to the order's flow. Empty when the order is not collecting data any more or its
     * flow already reached the terminal step.
     */
    @Transactional
    public Optional<FlowOutcome> advance(String marketplaceOrderId, String input) {
        Order order = orderRepository.findByMarketplaceOrderIdForUpdate(marketplaceOrderId).orElse(null);

        if (order == null || order.getStatus() != OrderStatus.AWAITING_DATA) {
            return Optional.empty();
        }

        FlowDefinition flow = flowRegistry.find(order.getFlowId()).orElse(null);

        if (flow == null) {
            log.warn("Order #{} refers to unknown flow {}", marketplaceOrderId, order.getFlowId());
            return Optional.empty();
        }

        FlowState state = readState(order.getFlowState());

        if (state != null && ConversationEngine.STEP_DONE.equals(state.getStep())) {
            return Optional.empty();
        }

        FlowResponse response = conversationEngine.step(flow, state, input, loadOverrides(order.getLotBindingId()));

        order.setFlowState(writeJson(response.getNewState()));
        order.setUpdatedAt(System.currentTimeMillis());

        if (response.isFinished()) {
            order.setStatus(OrderStatus.DATA_COLLECTED);
            order.setCollectedData(writeJson(response.getNewState().getData()));

            log.info("Order #{} collected data for flow {}", marketplaceOrderId, flow.getId());
        }

        orderRepository.save(order);

        return Optional.of(new FlowOutcome(order, response));
    }

    public Map<String, String> readCollectedData(Order order) {
        if (order.getCollectedData() == null) {
            return Collections.emptyMap();
        }

        try {
            return objectMapper.readValue(order.getCollectedData(), new TypeReference<Map<String, String>>() {
            });
        } catch (JsonProcessingException e) {
            log.warn("Malformed collected data of order #{}: {}", order.getMarketplaceOrderId(), e.getMessage());
            return Collections.emptyMap();
        }
    }

    Map<String, LocalizedMessage> loadOverrides(Long lotBindingId) {
        if (lotBindingId == null) {
            return Collections.emptyMap();
        }

        String customTexts = lotBindingRepository.findById(lotBindingId)
                .map(binding -> binding.getCustomTexts())
                .orElse(null);

        if (customTexts == null || customTexts.isBlank()) {
            return Collections.emptyMap();
        }

        try {
            Map<String, Map<String, String>> raw = objectMapper.readValue(customTexts, OVERRIDES_TYPE);
            Map<String, LocalizedMessage> overrides = new HashMap<>();

            raw.forEach((key, texts) -> {
                if (texts != null) {
                    overrides.put(key, LocalizedMessage.of(
                            texts.get(LocalizedMessage.LANG_RU),
                            texts.get(LocalizedMessage.LANG_EN)));
                }
            });

            return overrides;
        } catch (JsonProcessingException e) {
            log.warn("Malformed custom texts of lot binding {}: {}", lotBindingId, e.getMessage());
            return Collections.emptyMap();
        }
    }

    private FlowState readState(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }

        try {
            return objectMapper.readValue(json, FlowState.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed flow state: {}", e.getMessage());
            return null;
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    @Value
    public static class FlowOutcome {
        Order order;

        FlowResponse response;
    }
}
