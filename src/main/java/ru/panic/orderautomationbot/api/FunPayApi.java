package ru.panic.orderautomationbot.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;
import ru.panic.orderautomationbot.api.payload.FunPayAccountInfo;
import ru.panic.orderautomationbot.api.payload.FunPayCategory;
import ru.panic.orderautomationbot.api.payload.FunPayLot;
import ru.panic.orderautomationbot.api.payload.FunPayMessage;
import ru.panic.orderautomationbot.api.payload.FunPayOrderShortcut;
import ru.panic.orderautomationbot.api.payload.type.MarketplaceOrderStatus;
import ru.panic.orderautomationbot.exception.MarketplaceApiException;
import ru.panic.orderautomationbot.property.FunPayProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * FunPay seller account client. Authenticates with the golden key cookie, keeps the PHPSESSID and CSRF token
 * of the last {@link #refresh()} for POST requests.
 */
@Component
@Slf4j
public class FunPayApi {
    private static final long LATEST_MESSAGE_ID = 999_999_999_999L;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final FunPayHtmlParser funPayHtmlParser;
    private final FunPayProperty funPayProperty;
    private volatile FunPayAccountInfo account;

    public FunPayApi(RestTemplate restTemplate, ObjectMapper objectMapper, FunPayHtmlParser funPayHtmlParser, FunPayProperty funPayProperty) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.funPayHtmlParser = funPayHtmlParser;
        this.funPayProperty = funPayProperty;
    }

    /**
     * Loads the account page, which also keeps the session online.
     */
    public FunPayAccountInfo refresh() {
        ResponseEntity<String> response = exchange(HttpMethod.GET, funPayProperty.getBaseUrl() + "/", null, false);
        FunPayAccountInfo refreshed = funPayHtmlParser.parseAccountPage(body(response));
        String sessionId = extractCookie(response.getHeaders(), "PHPSESSID");

        if (sessionId == null && account != null) {
            sessionId = account.getSessionId();
        }
        refreshed.setSessionId(sessionId);

        account = refreshed;
        return refreshed;
    }

    public FunPayAccountInfo getAccount() {
        FunPayAccountInfo current = account;

        return current == null ? refresh() : current;
    }

    public Optional<String> getChatLocale(String chatId) {
        String url = UriComponentsBuilder.fromHttpUrl(funPayProperty.getBaseUrl() + "/chat/")
                .queryParam("node", chatId)
                .toUriString();

        return funPayHtmlParser.parseLocale(body(exchange(HttpMethod.GET, url, null, false)));
    }

    /**
     * Sends a chat message. The text is prefixed with {@link FunPayHtmlParser#BOT_CHARACTER} so the message is
     * recognised as our own when it comes back through the runner.
     */
    public void sendMessage(String chatId, String text) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("action", "chat_message");

        ObjectNode data = request.putObject("data");
        data.put("node", chatId);
        data.put("last_message", -1);
        data.put("content", FunPayHtmlParser.BOT_CHARACTER + text);

        JsonNode response = runner(objectMapper.createArrayNode(), request);
        JsonNode error = response.path("response").path("error");

        if (!error.isMissingNode() && !error.isNull() && !error.asText().isBlank()) {
            throw new MarketplaceApiException("Chat " + chatId + " rejected the message: " + error.asText());
        }
    }

    /**
     * Latest page of the chat history, oldest message first.
     */
    public List<FunPayMessage> getChatHistory(String chatId) {
        String url = UriComponentsBuilder.fromHttpUrl(funPayProperty.getBaseUrl() + "/chat/history")
                .queryParam("node", chatId)
                .queryParam("last_message", LATEST_MESSAGE_ID)
                .toUriString();

        return funPayHtmlParser.parseChatHistory(body(exchange(HttpMethod.GET, url, null, true)), chatId);
    }

    /**
     * Reads the sales list newest first, following the "continue" token for at most {@code maxPages} pages.
     */
    public List<FunPayOrderShortcut> getSales(Set<MarketplaceOrderStatus> statuses, int maxPages) {
        long userId = getAccount().getUserId();
        String url = funPayProperty.getBaseUrl() + "/orders/trade";
        List<FunPayOrderShortcut> orders = new ArrayList<>();

        FunPayHtmlParser.SalesPage page = funPayHtmlParser.parseSalesPage(
                body(exchange(HttpMethod.GET, url, null, false)), userId);
        int pages = 1;

        while (true) {
            page.getOrders().stream()
                    .filter(order -> statuses.contains(order.getStatus()))
                    .forEach(orders::add);

            if (page.getContinueToken() == null || pages >= maxPages) {
                break;
            }

            MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
            form.add("continue", page.getContinueToken());

            page = funPayHtmlParser.parseSalesPage(body(exchange(HttpMethod.POST, url, form, true)), userId);
            pages++;
        }

        return orders;
    }

    public List<FunPayCategory> getCategories() {
        return funPayHtmlParser.parseCategories(body(exchange(HttpMethod.GET, funPayProperty.getBaseUrl() + "/", null, false)));
    }

    public List<FunPayLot> getMySubcategoryLots(long subcategoryId) {
        String url = funPayProperty.getBaseUrl() + "/lots/" + subcategoryId + "/trade";

        return funPayHtmlParser.parseTradeLots(body(exchange(HttpMethod.GET, url, null, false)), subcategoryId);
    }

    public void raiseLots(long categoryId, List<Long> subcategoryIds) {
        if (subcategoryIds.isEmpty()) {
            return;
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("game_id", String.valueOf(categoryId));
        form.add("node_id", String.valueOf(subcategoryIds.get(0)));
        subcategoryIds.forEach(id -> form.add("node_ids[]", String.valueOf(id)));

        JsonNode response = readJson(body(exchange(HttpMethod.POST, funPayProperty.getBaseUrl() + "/lots/raise", form, true)));

        if (response.path("error").asBoolean(false)) {
            throw new MarketplaceApiException("Raise of category " + categoryId + " failed: " + response.path("msg").asText());
        }

        log.info("Raised category {} subcategories {}: {}", categoryId, subcategoryIds, response.path("msg").asText());
    }

    public void refund(String orderId) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("id", orderId);
        form.add("csrf_token", getAccount().getCsrfToken());

        JsonNode response = readJson(body(exchange(HttpMethod.POST, funPayProperty.getBaseUrl() + "/orders/refund", form, true)));

        if (response.path("error").asBoolean(false)) {
            throw new MarketplaceApiException("Refund of #" + orderId + " failed: " + response.path("msg").asText());
        }

        log.info("Order #{} refunded", orderId);
    }

    public Optional<Double> getRating() {
        String url = funPayProperty.getBaseUrl() + "/users/" + getAccount().getUserId() + "/";

        return funPayHtmlParser.parseRating(body(exchange(HttpMethod.GET, url, null, false)));
    }

    /**
     * POSTs to the runner endpoint that serves both update polling and actions.
     */
    public JsonNode runner(ArrayNode objects, ObjectNode request) {
        FunPayAccountInfo current = getAccount();
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();

        try {
            form.add("objects", objectMapper.writeValueAsString(objects));
            form.add("request", request == null ? "false" : objectMapper.writeValueAsString(request));
        } catch (JsonProcessingException e) {
            throw new MarketplaceApiException("Cannot serialize runner request", e);
        }
        form.add("csrf_token", current.getCsrfToken());

        return readJson(body(exchange(HttpMethod.POST, funPayProperty.getBaseUrl() + "/runner/", form, true)));
    }

    static String extractCookie(HttpHeaders headers, String name) {
        List<String> cookies = headers.get(HttpHeaders.SET_COOKIE);

        if (cookies == null) {
            return null;
        }

        for (String cookie : cookies) {
            if (cookie.startsWith(name + "=")) {
                int end = cookie.indexOf(';');

                return cookie.substring(name.length() + 1, end < 0 ? cookie.length() : end);
            }
        }

        return null;
    }

    private ResponseEntity<String> exchange(HttpMethod method, String url, MultiValueMap<String, String> form, boolean isAjax) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, funPayProperty.getUserAgent());
        headers.set(HttpHeaders.COOKIE, cookieHeader());

        if (isAjax) {
            headers.set("X-Requested-With", "XMLHttpRequest");
            headers.setAccept(List.of(MediaType.APPLICATION_JSON, MediaType.TEXT_HTML));
        }
        if (form != null) {
            headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        }

        try {
            return restTemplate.exchange(url, method, new HttpEntity<>(form, headers), String.class);
        } catch (RestClientException e) {
            throw new MarketplaceApiException(method + " " + url + " failed: " + e.getMessage(), e);
        }
    }

    private String cookieHeader() {
        StringBuilder cookie = new StringBuilder("golden_key=").append(funPayProperty.getGoldenKey());
        FunPayAccountInfo current = account;

        if (current != null && current.getSessionId() != null) {
            cookie.append("; PHPSESSID=").append(current.getSessionId());
        }

        return cookie.toString();
    }

    private JsonNode readJson(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MarketplaceApiException("Malformed json response", e);
        }
    }

    private static String body(ResponseEntity<String> response) {
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new MarketplaceApiException("Unexpected response " + response.getStatusCode());
        }
        return response.getBody();
    }
}
