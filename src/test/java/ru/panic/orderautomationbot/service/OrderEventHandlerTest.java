package ru.panic.orderautomationbot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import ru.panic.orderautomationbot.api.FunPayApi;
import ru.panic.orderautomationbot.api.event.NewMessageEvent;
import ru.panic.orderautomationbot.api.event.NewOrderEvent;
import ru.panic.orderautomationbot.api.event.OrderStatusChangedEvent;
import ru.panic.orderautomationbot.api.payload.FunPayAccountInfo;
import ru.panic.orderautomationbot.api.payload.FunPayMessage;
import ru.panic.orderautomationbot.api.payload.FunPayOrderShortcut;
import ru.panic.orderautomationbot.api.payload.type.MarketplaceOrderStatus;
import ru.panic.orderautomationbot.api.payload.type.MessageType;
import ru.panic.orderautomationbot.bot.TelegramBot;
import ru.panic.orderautomationbot.exception.MarketplaceApiException;
import ru.panic.orderautomationbot.flow.FlowMatch;
import ru.panic.orderautomationbot.flow.FlowMatcher;
import ru.panic.orderautomationbot.flow.FlowResponse;
import ru.panic.orderautomationbot.flow.FlowState;
import ru.panic.orderautomationbot.flow.LocalizedMessage;
import ru.panic.orderautomationbot.model.AutomationSettings;
import ru.panic.orderautomationbot.model.Order;
import ru.panic.orderautomationbot.model.type.OrderStatus;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("OrderEventHandler Unit Tests")
class OrderEventHandlerTest {
    private static final String CHAT_ID = "users-1001-2002";
    private static final String ORDER_ID = "ABCD1234";

    @Mock
    private OrderService orderService;
    @Mock
    private FlowService flowService;
    @Mock
    private FlowMatcher flowMatcher;
    @Mock
    private LanguageDetector languageDetector;
    @Mock
    private BuyerMessageService buyerMessageService;
    @Mock
    private ReviewReminderService reviewReminderService;
    @Mock
    private AutomationSettingsService automationSettingsService;
    @Mock
    private RatingChangeProbe ratingChangeProbe;
    @Mock
    private FunPayApi funPayApi;
    @Mock
    private TelegramBot telegramBot;

    @InjectMocks
    private OrderEventHandler handler;

    @BeforeEach
    void setUp() {
        when(funPayApi.getAccount()).thenReturn(FunPayAccountInfo.builder().userId(1001L).build());
        when(automationSettingsService.get()).thenReturn(AutomationSettings.defaults());
    }

    private static FunPayOrderShortcut shortcut(MarketplaceOrderStatus status) {
        return FunPayOrderShortcut.builder()
                .id(ORDER_ID)
                .description("Spotify Premium 1 month")
                .price(299d)
                .currency("₽")
                .buyerId(2002L)
                .buyerUsername("BuyerOne")
                .chatId(CHAT_ID)
                .status(status)
                .build();
    }

    private static Order order(OrderStatus status) {
        return Order.builder()
                .marketplaceOrderId(ORDER_ID)
                .chatId(CHAT_ID)
                .buyerId(2002L)
                .buyerUsername("BuyerOne")
                .description("Spotify Premium 1 month")
                .buyerLang("en")
                .status(status)
                .build();
    }

    private static FunPayMessage buyerMessage(String text) {
        return FunPayMessage.builder()
                .id(1500L)
                .chatId(CHAT_ID)
                .authorId(2002L)
                .authorName("BuyerOne")
                .text(text)
                .type(MessageType.NON_SYSTEM)
                .build();
    }

    @Nested
    @DisplayName("new order")
    class NewOrderTests {

        @Test
        @DisplayName("should create the order, notify the operator and send the first prompt")
        void shouldStartFlow() {
            // Arrange
            FlowMatch match = new FlowMatch("spotify", 1L);
            LocalizedMessage prompt = LocalizedMessage.of("почта?", "email?");

            when(orderService.findByMarketplaceOrderId(ORDER_ID)).thenReturn(Optional.empty());
            when(funPayApi.getChatLocale(CHAT_ID)).thenReturn(Optional.of("en"));
            when(flowMatcher.match(anyString(), any())).thenReturn(Optional.of(match));
            when(orderService.createIfAbsent(any(), eq(match), eq("en"), eq(OrderStatus.AWAITING_DATA))).thenReturn(true);
            when(flowService.startFlow(ORDER_ID)).thenReturn(Optional.of(new FlowService.FlowOutcome(
                    order(OrderStatus.AWAITING_DATA),
                    new FlowResponse(new FlowState("wait_email", new LinkedHashMap<>()), prompt, false))));

            // Act
            handler.handleEvent(new NewOrderEvent(shortcut(MarketplaceOrderStatus.PAID)));

            // Assert
            ArgumentCaptor<String> notification = ArgumentCaptor.forClass(String.class);
            verify(telegramBot).notifyOperator(notification.capture());
            assertThat(notification.getValue()).contains(ORDER_ID, "BuyerOne", "spotify");
            verify(buyerMessageService).send(CHAT_ID, prompt, "en");
        }

        @Test
        @DisplayName("should detect the language when the chat page has no locale")
        void shouldDetectLanguage() {
            // Arrange
            when(orderService.findByMarketplaceOrderId(ORDER_ID)).thenReturn(Optional.empty());
            when(funPayApi.getChatLocale(CHAT_ID)).thenThrow(new MarketplaceApiException("timeout"));
            when(languageDetector.detect(anyString())).thenReturn("ru");
            when(flowMatcher.match(anyString(), any())).thenReturn(Optional.empty());
            when(orderService.createIfAbsent(any(), any(), eq("ru"), eq(OrderStatus.DATA_COLLECTED))).thenReturn(true);

            // Act
            handler.handleEvent(new NewOrderEvent(shortcut(MarketplaceOrderStatus.PAID)));

            // Assert
            verify(telegramBot).notifyOperator(contains("none"));
            verify(flowService, never()).startFlow(anyString());
            verifyNoInteractions(buyerMessageService);
        }

        @Test
        @DisplayName("should ignore an order that is already stored")
        void shouldIgnoreKnownOrder() {
            // Arrange
            when(orderService.findByMarketplaceOrderId(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.AWAITING_DATA)));

            // Act
            handler.handleEvent(new NewOrderEvent(shortcut(MarketplaceOrderStatus.PAID)));

            // Assert
            verify(orderService, never()).createIfAbsent(any(), any(), any(), any());
            verifyNoInteractions(telegramBot, buyerMessageService);
        }
    }

    @Nested
    @DisplayName("status change")
    class StatusChangeTests {

        @Test
        @DisplayName("should schedule a review reminder when the order gets confirmed")
        void shouldScheduleReminder() {
            // Arrange
            when(orderService.applyMarketplaceStatus(ORDER_ID, MarketplaceOrderStatus.CLOSED)).thenReturn(Optional.of(
                    new OrderStatusTransition(order(OrderStatus.CONFIRMED), OrderStatus.COMPLETED, OrderStatus.CONFIRMED)));

            // Act
            handler.handleEvent(new OrderStatusChangedEvent(shortcut(MarketplaceOrderStatus.CLOSED)));

            // Assert
            verify(reviewReminderService).schedule(eq(ORDER_ID), any(AutomationSettings.class));
        }

        @Test
        @DisplayName("should not schedule a reminder for a refunded order")
        void shouldNotRemindRefunded() {
            // Arrange
            when(orderService.applyMarketplaceStatus(ORDER_ID, MarketplaceOrderStatus.CLOSED)).thenReturn(Optional.of(
                    new OrderStatusTransition(order(OrderStatus.REFUNDED), OrderStatus.REFUNDED, OrderStatus.REFUNDED)));

            // Act
            handler.handleEvent(new OrderStatusChangedEvent(shortcut(MarketplaceOrderStatus.CLOSED)));

            // Assert
            verifyNoInteractions(reviewReminderService);
        }

        @Test
        @DisplayName("should notify the operator about a reopened order")
        void shouldNotifyDispute() {
            // Arrange
            when(orderService.applyMarketplaceStatus(ORDER_ID, MarketplaceOrderStatus.PAID)).thenReturn(Optional.of(
                    new OrderStatusTransition(order(OrderStatus.DISPUTE), OrderStatus.CONFIRMED, OrderStatus.DISPUTE)));

            // Act
            handler.handleEvent(new OrderStatusChangedEvent(shortcut(MarketplaceOrderStatus.PAID)));

            // Assert
            verify(telegramBot).notifyOperator(contains(ORDER_ID));
            verifyNoInteractions(reviewReminderService);
        }
    }

    @Nested
    @DisplayName("new message")
    class NewMessageTests {

        @Test
        @DisplayName("should advance the awaiting order's flow and reply")
        void shouldAdvanceFlow() {
            // Arrange
            LocalizedMessage reply = LocalizedMessage.of("пароль?", "password?");

            when(orderService.findAwaitingData(CHAT_ID, 2002L)).thenReturn(Optional.of(order(OrderStatus.AWAITING_DATA)));
            when(flowService.advance(ORDER_ID, "user@mail.com")).thenReturn(Optional.of(new FlowService.FlowOutcome(
                    order(OrderStatus.AWAITING_DATA),
                    new FlowResponse(new FlowState("wait_password", new LinkedHashMap<>(Map.of("email", "user@mail.com"))), reply, false))));

            // Act
            handler.handleEvent(new NewMessageEvent(buyerMessage("user@mail.com")));

            // Assert
            verify(buyerMessageService).send(CHAT_ID, reply, "en");
            verifyNoInteractions(telegramBot);
        }

        @Test
        @DisplayName("should tell the operator when the flow collected all data")
        void shouldNotifyDataCollected() {
            // Arrange
            Order collected = order(OrderStatus.DATA_COLLECTED);

            when(orderService.findAwaitingData(CHAT_ID, 2002L)).thenReturn(Optional.of(order(OrderStatus.AWAITING_DATA)));
            when(flowService.advance(ORDER_ID, "+")).thenReturn(Optional.of(new FlowService.FlowOutcome(
                    collected,
                    new FlowResponse(new FlowState("done", new LinkedHashMap<>(Map.of("email", "user@mail.com"))),
                            LocalizedMessage.of("готово", "done"), true))));

            // Act
            handler.handleEvent(new NewMessageEvent(buyerMessage("+")));

            // Assert
            ArgumentCaptor<String> notification = ArgumentCaptor.forClass(String.class);
            verify(telegramBot).notifyOperator(notification.capture());
            assertThat(notification.getValue()).contains(ORDER_ID, "email: user@mail.com");
        }

        @Test
        @DisplayName("should forward a message without an awaiting order to the operator")
        void shouldForwardToOperator() {
            // Arrange
            when(orderService.findAwaitingData(CHAT_ID, 2002L)).thenReturn(Optional.empty());

            // Act
            handler.handleEvent(new NewMessageEvent(buyerMessage("hello?")));

            // Assert
            verify(telegramBot).notifyOperator(contains(OrderEventHandler.CHAT_URL + CHAT_ID));
            verifyNoInteractions(flowService);
        }

        @Test
        @DisplayName("should ignore own and bot-authored messages")
        void shouldIgnoreOwnMessages() {
            // Arrange
            FunPayMessage own = buyerMessage("thanks");
            own.setAuthorId(1001L);
            FunPayMessage byBot = buyerMessage("thanks");
            byBot.setByBot(true);

            // Act
            handler.handleEvent(new NewMessageEvent(own));
            handler.handleEvent(new NewMessageEvent(byBot));

            // Assert
            verifyNoInteractions(orderService, flowService, telegramBot);
        }

        @Test
        @DisplayName("should confirm the order named in a confirmation notice without scheduling a reminder")
        void shouldConfirmFromSystemNotice() {
            // Arrange
            FunPayMessage notice = FunPayMessage.builder()
                    .id(1501L)
                    .chatId(CHAT_ID)
                    .authorId(0L)
                    .text("Покупатель BuyerOne подтвердил успешное выполнение заказа #ABCD1234")
                    .type(MessageType.ORDER_CONFIRMED)
                    .build();

            // Act
            handler.handleEvent(new NewMessageEvent(notice));

            // Assert
            verify(orderService).applyMarketplaceStatus(ORDER_ID, MarketplaceOrderStatus.CLOSED);
            verifyNoInteractions(reviewReminderService);
        }

        @Test
        @DisplayName("should probe the rating on a feedback notice")
        void shouldProbeRating() {
            // Arrange
            FunPayMessage notice = FunPayMessage.builder()
                    .id(1502L)
                    .chatId(CHAT_ID)
                    .authorId(0L)
                    .text("Покупатель BuyerOne написал отзыв к заказу #ABCD1234.")
                    .type(MessageType.NEW_FEEDBACK)
                    .build();

            // Act
            handler.handleEvent(new NewMessageEvent(notice));

            // Assert
            verify(ratingChangeProbe).probeAsync(notice.getText());
        }
    }
}
