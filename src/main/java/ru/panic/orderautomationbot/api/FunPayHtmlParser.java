package ru.panic.orderautomationbot.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import ru.panic.orderautomationbot.api.payload.FunPayAccountInfo;
import ru.panic.orderautomationbot.api.payload.FunPayCategory;
import ru.panic.orderautomationbot.api.payload.FunPayChatShortcut;
import ru.panic.orderautomationbot.api.payload.FunPayLot;
import ru.panic.orderautomationbot.api.payload.FunPayMessage;
import ru.panic.orderautomationbot.api.payload.FunPayOrderShortcut;
import ru.panic.orderautomationbot.api.payload.FunPaySubcategory;
import ru.panic.orderautomationbot.api.payload.type.MarketplaceOrderStatus;
import ru.panic.orderautomationbot.api.payload.type.MessageType;
import ru.panic.orderautomationbot.exception.MarketplaceApiException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns FunPay html pages and runner payloads into payload objects. Holds no session state.
 */
@Component
@RequiredArgsConstructor
public class FunPayHtmlParser {
    public static final String BOT_CHARACTER = "\u2064";

    private static final Pattern USER_HREF_PATTERN = Pattern.compile("/users/(\\d+)/?");
    private static final Pattern LOTS_HREF_PATTERN = Pattern.compile("/lots/(\\d+)/?");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\d[\\d\\s\u00a0]*(?:[.,]\\d+)?");

    private static final Pattern ORDER_CONFIRMED_PATTERN = Pattern.compile(
            "подтвердил успешное выполнение заказа|has confirmed that order", Pattern.CASE_INSENSITIVE);
    private static final Pattern NEW_FEEDBACK_PATTERN = Pattern.compile(
            "написал отзыв к заказу|has given feedback to the order", Pattern.CASE_INSENSITIVE);
    private static final Pattern FEEDBACK_CHANGED_PATTERN = Pattern.compile(
            "изменил отзыв к заказу|has edited their feedback to the order", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public FunPayAccountInfo parseAccountPage(String html) {
        Document document = Jsoup.parse(html);
        JsonNode appData = readAppData(document)
                .orElseThrow(() -> new MarketplaceApiException("Account page has no app data, golden key expired?"));

        long userId = appData.path("userId").asLong(0);

        if (userId == 0) {
            throw new MarketplaceApiException("Account page has no user id, golden key expired?");
        }

        Element username = document.selectFirst(".user-link-name");
        Element balance = document.selectFirst(".badge-balance");

        return FunPayAccountInfo.builder()
                .userId(userId)
                .username(username == null ? null : username.text().trim())
                .csrfToken(appData.path("csrf-token").asText(null))
                .locale(appData.path("locale").asText(null))
                .balance(balance == null ? 0d : parseNumber(balance.text()).orElse(0d))
                .currency(balance == null ? null : parseCurrency(balance.text()))
                .build();
    }

    public Optional<String> parseLocale(String html) {
        return readAppData(Jsoup.parse(html))
                .map(appData -> appData.path("locale").asText(""))
                .filter(locale -> locale.equals("ru") || locale.equals("en") || locale.equals("uk"));
    }

    public SalesPage parseSalesPage(String html, long myUserId) {
        Document document = Jsoup.parse(html);
        List<FunPayOrderShortcut> orders = new ArrayList<>();

        for (Element row : document.select("a.tc-item")) {
            Element orderId = row.selectFirst(".tc-order");

            if (orderId == null) {
                continue;
            }

            Element description = row.selectFirst(".order-desc div");
            Element price = row.selectFirst(".tc-price");
            Element buyer = row.selectFirst(".media-user-name span[data-href]");

            Long buyerId = null;
            String buyerUsername = null;

            if (buyer != null) {
                buyerUsername = buyer.text().trim();
                Matcher matcher = USER_HREF_PATTERN.matcher(buyer.attr("data-href"));

                if (matcher.find()) {
                    buyerId = Long.parseLong(matcher.group(1));
                }
            }

            orders.add(FunPayOrderShortcut.builder()
                    .id(orderId.text().trim().replace("#", ""))
                    .description(description == null ? "" : description.text().trim())
                    .price(price == null ? 0d : parseNumber(price.text()).orElse(0d))
                    .currency(price == null ? null : parseCurrency(price.text()))
                    .buyerId(buyerId)
                    .buyerUsername(buyerUsername)
                    .chatId(buyerId == null ? null : chatIdOf(myUserId, buyerId))
                    .status(parseSalesStatus(row))
                    .build());
        }

        Element continueInput = document.selectFirst("input[name=continue]");
        String continueToken = continueInput == null || continueInput.val().isBlank() ? null : continueInput.val();

        return new SalesPage(orders, continueToken);
    }

    public List<FunPayCategory> parseCategories(String html) {
        Document document = Jsoup.parse(html);
        List<FunPayCategory> categories = new ArrayList<>();

        for (Element item : document.select("div.promo-game-item")) {
            Element title = item.selectFirst(".game-title[data-id]");

            if (title == null) {
                continue;
            }

            List<FunPaySubcategory> subcategories = new ArrayList<>();

            for (Element link : item.select("ul.list-inline a[href]")) {
                Matcher matcher = LOTS_HREF_PATTERN.matcher(link.attr("href"));

                if (matcher.find()) {
                    subcategories.add(new FunPaySubcategory(Long.parseLong(matcher.group(1)), link.text().trim()));
                }
            }

            categories.add(FunPayCategory.builder()
                    .id(Long.parseLong(title.attr("data-id")))
                    .name(title.text().trim())
                    .subcategories(subcategories)
                    .build());
        }

        return categories;
    }

    public List<FunPayLot> parseTradeLots(String html, long subcategoryId) {
        List<FunPayLot> lots = new ArrayList<>();

        for (Element row : Jsoup.parse(html).select("a.tc-item[data-offer]")) {
            Element description = row.selectFirst(".tc-desc-text");
            Element price = row.selectFirst(".tc-price");

            lots.add(FunPayLot.builder()
                    .id(Long.parseLong(row.attr("data-offer")))
                    .subcategoryId(subcategoryId)
                    .description(description == null ? "" : description.text().trim())
                    .price(price == null ? null : parseNumber(price.hasAttr("data-s") ? price.attr("data-s") : price.text())
                            .orElse(null))
                    .build());
        }

        return lots;
    }

    public List<FunPayChatShortcut> parseChatBookmarks(String html) {
        List<FunPayChatShortcut> chats = new ArrayList<>();

        for (Element item : Jsoup.parse(html).select("a.contact-item")) {
            Element name = item.selectFirst(".media-user-name");
            Element lastMessage = item.selectFirst(".contact-item-message");
            String nodeMessage = item.attr("data-node-msg");

            chats.add(FunPayChatShortcut.builder()
                    .chatId(item.attr("data-id"))
                    .name(name == null ? null : name.text().trim())
                    .lastMessageId(nodeMessage.isBlank() ? 0L : Long.parseLong(nodeMessage))
                    .lastMessageText(lastMessage == null ? null : lastMessage.text())
                    .build());
        }

        return chats;
    }

    public List<FunPayMessage> parseChatHistory(String json, String chatId) {
        JsonNode messages;

        try {
            messages = objectMapper.readTree(json).path("chat").path("messages");
        } catch (JsonProcessingException e) {
            throw new MarketplaceApiException("Malformed chat history of " + chatId, e);
        }

        List<FunPayMessage> result = new ArrayList<>();

        for (JsonNode node : messages) {
            long authorId = node.path("author").asLong(0);
            Element html = Jsoup.parseBodyFragment(node.path("html").asText("")).body();
            Element textElement = html.selectFirst(".chat-msg-text");
            Element authorElement = html.selectFirst(".chat-msg-author-link");
            String text = textElement == null ? html.text() : textElement.wholeText().trim();

            result.add(FunPayMessage.builder()
                    .id(node.path("id").asLong())
                    .chatId(chatId)
                    .authorId(authorId)
                    .authorName(authorElement == null ? null : authorElement.text().trim())
                    .text(text)
                    .type(authorId == 0 ? classifySystemMessage(text) : MessageType.NON_SYSTEM)
                    .isByBot(text.startsWith(BOT_CHARACTER))
                    .build());
        }

        return result;
    }

    public Optional<Double> parseRating(String html) {
        Document document = Jsoup.parse(html);
        Element value = document.selectFirst(".rating-value .big");

        if (value != null) {
            Optional<Double> rating = parseNumber(value.text());

            if (rating.isPresent()) {
                return rating;
            }
        }

        Element stars = document.selectFirst("div.rating-stars");

        if (stars == null) {
            return Optional.empty();
        }

        int filled = stars.select("i.fas").size();

        return filled == 0 ? Optional.empty() : Optional.of((double) filled);
    }

    public Optional<String> parseSupportCsrfToken(String html) {
        Document document = Jsoup.parse(html);
        Element input = document.selectFirst("input#ticket__token");

        if (input != null && !input.val().isBlank()) {
            return Optional.of(input.val());
        }

        Element attribute = document.selectFirst("[data-csrf-token]");

        if (attribute != null && !attribute.attr("data-csrf-token").isBlank()) {
            return Optional.of(attribute.attr("data-csrf-token"));
        }

        for (Element script : document.select("script")) {
            String body = script.data();
            int start = body.indexOf("csrfToken\":\"");

            if (start >= 0) {
                start += "csrfToken\":\"".length();
                int end = body.indexOf('"', start);

                if (end > start) {
                    return Optional.of(body.substring(start, end));
                }
            }
        }

        return Optional.empty();
    }

    public static MessageType classifySystemMessage(String text) {
        if (text == null) {
            return MessageType.OTHER;
        }
        if (ORDER_CONFIRMED_PATTERN.matcher(text).find()) {
            return MessageType.ORDER_CONFIRMED;
        }
        if (FEEDBACK_CHANGED_PATTERN.matcher(text).find()) {
            return MessageType.FEEDBACK_CHANGED;
        }
        if (NEW_FEEDBACK_PATTERN.matcher(text).find()) {
            return MessageType.NEW_FEEDBACK;
        }
        return MessageType.OTHER;
    }

    public static String chatIdOf(long firstUserId, long secondUserId) {
        return "users-" + Math.min(firstUserId, secondUserId) + "-" + Math.max(firstUserId, secondUserId);
    }

    static Optional<Double> parseNumber(String text) {
        if (text == null) {
            return Optional.empty();
        }

        Matcher matcher = NUMBER_PATTERN.matcher(text);

        if (!matcher.find()) {
            return Optional.empty();
        }

        String number = matcher.group()
                .replace(" ", "")
                .replace("\u00a0", "")
                .replace(",", ".");

        return Optional.of(Double.parseDouble(number));
    }

    static String parseCurrency(String text) {
        String currency = text.replaceAll("[\\d\\s\u00a0.,]", "");

        return currency.isEmpty() ? null : currency;
    }

    private static MarketplaceOrderStatus parseSalesStatus(Element row) {
        if (row.hasClass("warning")) {
            return MarketplaceOrderStatus.REFUNDED;
        }
        if (row.hasClass("info")) {
            return MarketplaceOrderStatus.PAID;
        }
        return MarketplaceOrderStatus.CLOSED;
    }

    private Optional<JsonNode> readAppData(Document document) {
        String appData = document.body() == null ? "" : document.body().attr("data-app-data");

        if (appData.isBlank()) {
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readTree(appData));
        } catch (JsonProcessingException e) {
            throw new MarketplaceApiException("Malformed app data", e);
        }
    }

    @Value
    public static class SalesPage {
        List<FunPayOrderShortcut> orders;

        // null on the last page
        String continueToken;
    }
}
