package ru.panic.orderautomationbot.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.panic.orderautomationbot.api.event.MarketplaceEvent;
import ru.panic.orderautomationbot.api.event.NewMessageEvent;
import ru.panic.orderautomationbot.api.event.NewOrderEvent;
import ru.panic.orderautomationbot.api.event.OrderStatusChangedEvent;
import ru.panic.orderautomationbot.api.payload.FunPayChatShortcut;
import ru.panic.orderautomationbot.api.payload.FunPayMessage;
import ru.panic.orderautomationbot.api.payload.FunPayOrderShortcut;
import ru.panic.orderautomationbot.api.payload.type.MarketplaceOrderStatus;
import ru.panic.orderautomationbot.exception.MarketplaceApiException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the runner endpoint into a stream of typed events. Each {@link #poll()} compares the orders counter and
 * chat bookmark tags with the previous ones, and on a change diffs the first sales page and the chats' last
 * message ids against what it has already seen. The first poll only records the current state. A tag is
 * accepted only after the data behind it has been fetched, so a failed fetch is retried on the next poll.
 * Not thread safe, polled from the single listener thread.
 */
@Component
@Slf4j
public class FunPayRunner {
    private static final String ORDERS_COUNTERS = "orders_counters";
    private static final String CHAT_BOOKMARKS = "chat_bookmarks";
    private static final String INITIAL_TAG = "00000000";

    private final FunPayApi funPayApi;
    private final FunPayHtmlParser funPayHtmlParser;
    private final ObjectMapper objectMapper;
    private final Map<String, MarketplaceOrderStatus> knownOrderStatuses = new HashMap<>();
    private final Map<String, Long> knownLastMessageIds = new HashMap<>();
    private String ordersCountersTag = INITIAL_TAG;
    private String chatBookmarksTag = INITIAL_TAG;
    private boolean isPrimed;

    public FunPayRunner(FunPayApi funPayApi, FunPayHtmlParser funPayHtmlParser, ObjectMapper objectMapper) {
        this.funPayApi = funPayApi;
        this.funPayHtmlParser = funPayHtmlParser;
        this.objectMapper = objectMapper;
    }

    public List<MarketplaceEvent> poll() {
        long userId = funPayApi.getAccount().getUserId();

        ArrayNode objects = objectMapper.createArrayNode();
        objects.add(watchedObject(ORDERS_COUNTERS, userId, ordersCountersTag));
        objects.add(watchedObject(CHAT_BOOKMARKS, userId, chatBookmarksTag));

        JsonNode response = funPayApi.runner(objects, null);

        String newOrdersTag = null;
        String newChatsTag = null;
        List<FunPayChatShortcut> changedChats = Collections.emptyList();

        for (JsonNode object : response.path("objects")) {
            String type = object.path("type").asText();
            String tag = object.path("tag").asText(INITIAL_TAG);

            if (ORDERS_COUNTERS.equals(type) && !tag.equals(ordersCountersTag)) {
                newOrdersTag = tag;
            } else if (CHAT_BOOKMARKS.equals(type) && !tag.equals(chatBookmarksTag)) {
                newChatsTag = tag;
                changedChats = funPayHtmlParser.parseChatBookmarks(object.path("data").path("html").asText(""));
            }
        }

        if (!isPrimed) {
            prime(changedChats);
            ordersCountersTag = newOrdersTag == null ? ordersCountersTag : newOrdersTag;
            chatBookmarksTag = newChatsTag == null ? chatBookmarksTag : newChatsTag;
            return Collections.emptyList();
        }

        List<MarketplaceEvent> events = new ArrayList<>();

        if (newOrdersTag != null) {
            try {
                events.addAll(diffOrders());
                ordersCountersTag = newOrdersTag;
            } catch (MarketplaceApiException e) {
                log.warn("Sales diff failed, retrying on the next poll: {}", e.getMessage());
            }
        }

        boolean isChatsDiffed = true;

        for (FunPayChatShortcut chat : changedChats) {
            try {
                events.addAll(diffChat(chat));
            } catch (MarketplaceApiException e) {
                isChatsDiffed = false;
                log.warn("History of chat {} failed, retrying on the next poll: {}", chat.getChatId(), e.getMessage());
            }
        }

        if (newChatsTag != null && isChatsDiffed) {
            chatBookmarksTag = newChatsTag;
        }

        return events;
    }

    private void prime(List<FunPayChatShortcut> chats) {
        for (FunPayOrderShortcut order : funPayApi.getSales(EnumSet.allOf(MarketplaceOrderStatus.class), 1)) {
            knownOrderStatuses.put(order.getId(), order.getStatus());
        }
        for (FunPayChatShortcut chat : chats) {
            knownLastMessageIds.put(chat.getChatId(), chat.getLastMessageId());
        }

        isPrimed = true;
        log.info("Runner primed with {} orders and {} chats", knownOrderStatuses.size(), knownLastMessageIds.size());
    }

    /**
     * Known statuses are updated only once the sales page has been fetched, a failed fetch leaves them untouched.
     */
    private List<MarketplaceEvent> diffOrders() {
        List<FunPayOrderShortcut> sales = funPayApi.getSales(EnumSet.allOf(MarketplaceOrderStatus.class), 1);
        List<MarketplaceEvent> newOrders = new ArrayList<>();
        List<MarketplaceEvent> statusChanges = new ArrayList<>();

        // the sales page lists newest first, events go out oldest first
        for (int i = sales.size() - 1; i >= 0; i--) {
            FunPayOrderShortcut order = sales.get(i);
            MarketplaceOrderStatus previous = knownOrderStatuses.put(order.getId(), order.getStatus());

            if (previous == null) {
                newOrders.add(new NewOrderEvent(order));
            } else if (previous != order.getStatus()) {
                statusChanges.add(new OrderStatusChangedEvent(order));
            }
        }

        newOrders.addAll(statusChanges);
        return newOrders;
    }

    private List<MarketplaceEvent> diffChat(FunPayChatShortcut chat) {
        long known = knownLastMessageIds.getOrDefault(chat.getChatId(), 0L);

        if (chat.getLastMessageId() == null || chat.getLastMessageId() <= known) {
            return Collections.emptyList();
        }

        List<FunPayMessage> history = funPayApi.getChatHistory(chat.getChatId());
        List<MarketplaceEvent> events = new ArrayList<>();
        long last = known;

        for (FunPayMessage message : history) {
            if (message.getId() > known) {
                events.add(new NewMessageEvent(message));
                last = Math.max(last, message.getId());
            }
        }

        knownLastMessageIds.put(chat.getChatId(), Math.max(last, chat.getLastMessageId()));
        return events;
    }

    private ObjectNode watchedObject(String type, long userId, String tag) {
        ObjectNode object = objectMapper.createObjectNode();
        object.put("type", type);
        object.put("id", userId);
        object.put("tag", tag);
        object.put("data", false);
        return object;
    }
}
