package ru.panic.orderautomationbot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import ru.panic.orderautomationbot.api.FunPayApi;
import ru.panic.orderautomationbot.api.FunPaySupportApi;
import ru.panic.orderautomationbot.api.payload.FunPayAccountInfo;
import ru.panic.orderautomationbot.bot.TelegramBot;
import ru.panic.orderautomationbot.exception.MarketplaceApiException;
import ru.panic.orderautomationbot.exception.SupportAuthorizationException;
import ru.panic.orderautomationbot.model.AutomationSettings;
import ru.panic.orderautomationbot.model.Order;
import ru.panic.orderautomationbot.model.type.OrderStatus;
import ru.panic.orderautomationbot.property.AutomationProperty;
import ru.panic.orderautomationbot.repository.OrderRepository;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.longThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("SupportEscalationService Unit Tests")
class SupportEscalationServiceTest {
    @Mock
    private FunPaySupportApi funPaySupportApi;
    @Mock
    private FunPayApi funPayApi;
    @Mock
    private OrderRepository orderRepository;
    @Mock
    private AutomationSettingsService automationSettingsService;
    @Mock
    private TelegramBot telegramBot;

    private SupportEscalationService service;

    @BeforeEach
    void setUp() {
        AutomationProperty automationProperty = new AutomationProperty();
        automationProperty.setSupportAttempts(3);
        automationProperty.setSupportBackoffMillis(0);

        service = new SupportEscalationService(funPaySupportApi, funPayApi, orderRepository,
                automationSettingsService, telegramBot, automationProperty);

        when(funPayApi.getAccount()).thenReturn(FunPayAccountInfo.builder().userId(1001L).username("SellerName").build());
        when(automationSettingsService.get()).thenReturn(AutomationSettings.defaults());
    }

    @Test
    @DisplayName("should substitute order ids into the templates")
    void shouldRenderTemplates() {
        assertThat(SupportEscalationService.renderTemplate("Confirm {order_ids} please", List.of("A", "B"), false))
                .isEqualTo("Confirm #A, #B please");
        assertThat(SupportEscalationService.renderTemplate("Confirm {order_id} please", List.of("A"), true))
                .isEqualTo("Confirm #A please");
    }

    @Nested
    @DisplayName("escalate")
    class EscalateTests {

        @Test
        @DisplayName("should file one ticket for the first order with the seller name")
        void shouldFileTicket() {
            // Arrange
            when(funPaySupportApi.openSession()).thenReturn("session");
            when(funPaySupportApi.fetchCsrfToken("session")).thenReturn("csrf");
            when(funPaySupportApi.submitTicket("session", "csrf", "SellerName", "ABCD1234", "Confirm #ABCD1234"))
                    .thenReturn("777");

            // Act
            SupportTicketResult result = service.escalate(List.of("#ABCD1234"), "Confirm {order_id}", true);

            // Assert
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getTicketId()).isEqualTo("777");
        }

        @Test
        @DisplayName("should retry authorization failures up to the attempt limit")
        void shouldRetryAuthorizationFailures() {
            // Arrange
            when(funPaySupportApi.openSession())
                    .thenThrow(new SupportAuthorizationException("no jwt"))
                    .thenThrow(new SupportAuthorizationException("no jwt"))
                    .thenReturn("session");
            when(funPaySupportApi.fetchCsrfToken("session")).thenReturn("csrf");
            when(funPaySupportApi.submitTicket(anyString(), anyString(), anyString(), anyString(), anyString())).thenReturn("");

            // Act
            SupportTicketResult result = service.escalate(List.of("ABCD1234"), "{order_ids}", false);

            // Assert
            assertThat(result.isSuccess()).isTrue();
            verify(funPaySupportApi, times(3)).openSession();
        }

        @Test
        @DisplayName("should give up after the last attempt and tell the operator")
        void shouldGiveUp() {
            // Arrange
            when(funPaySupportApi.openSession()).thenThrow(new SupportAuthorizationException("no jwt"));

            // Act
            SupportTicketResult result = service.escalate(List.of("ABCD1234"), "{order_ids}", false);

            // Assert
            assertThat(result.isSuccess()).isFalse();
            verify(funPaySupportApi, times(3)).openSession();
            verify(telegramBot).notifyOperator(contains("#ABCD1234"));
        }

        @Test
        @DisplayName("should not retry other failures")
        void shouldNotRetryOtherFailures() {
            // Arrange
            when(funPaySupportApi.openSession()).thenReturn("session");
            when(funPaySupportApi.fetchCsrfToken("session")).thenReturn("csrf");
            when(funPaySupportApi.submitTicket(anyString(), anyString(), anyString(), anyString(), anyString()))
                    .thenThrow(new MarketplaceApiException("500"));

            // Act
            SupportTicketResult result = service.escalate(List.of("ABCD1234"), "{order_ids}", false);

            // Assert
            assertThat(result.isSuccess()).isFalse();
            verify(funPaySupportApi, times(1)).openSession();
        }
    }

    @Nested
    @DisplayName("escalateCompletedOrders")
    class EscalateCompletedOrdersTests {

        @Test
        @DisplayName("should escalate candidates in one ticket and stamp them")
        void shouldEscalateAndStamp() {
            // Arrange
            AutomationSettings settings = AutomationSettings.defaults();
            when(orderRepository.findEscalationCandidates(eq(OrderStatus.COMPLETED), anyLong(), eq(5))).thenReturn(List.of(
                    Order.builder().marketplaceOrderId("AAAA0001").status(OrderStatus.COMPLETED).build(),
                    Order.builder().marketplaceOrderId("AAAA0002").status(OrderStatus.COMPLETED).build()));
            when(funPaySupportApi.openSession()).thenReturn("session");
            when(funPaySupportApi.fetchCsrfToken("session")).thenReturn("csrf");
            when(funPaySupportApi.submitTicket(eq("session"), eq("csrf"), eq("SellerName"), eq("AAAA0001"), contains("#AAAA0001, #AAAA0002")))
                    .thenReturn("900");

            // Act
            int escalated = service.escalateCompletedOrders(settings);

            // Assert
            assertThat(escalated).isEqualTo(2);
            verify(orderRepository).updateEscalatedAtByMarketplaceOrderIdIn(anyLong(), eq(List.of("AAAA0001", "AAAA0002")));
        }

        @Test
        @DisplayName("should not stamp anything when the ticket failed")
        void shouldNotStampOnFailure() {
            // Arrange
            when(orderRepository.findEscalationCandidates(any(), anyLong(), anyInt())).thenReturn(List.of(
                    Order.builder().marketplaceOrderId("AAAA0001").status(OrderStatus.COMPLETED).build()));
            when(funPaySupportApi.openSession()).thenThrow(new MarketplaceApiException("down"));

            // Act
            int escalated = service.escalateCompletedOrders(AutomationSettings.defaults());

            // Assert
            assertThat(escalated).isZero();
            verify(orderRepository, never()).updateEscalatedAtByMarketplaceOrderIdIn(anyLong(), any());
        }

        @Test
        @DisplayName("should do nothing without candidates")
        void shouldSkipWithoutCandidates() {
            // Arrange
            when(orderRepository.findEscalationCandidates(any(), anyLong(), anyInt())).thenReturn(List.of());

            // Act
            int escalated = service.escalateCompletedOrders(AutomationSettings.defaults());

            // Assert
            assertThat(escalated).isZero();
            verify(funPaySupportApi, never()).openSession();
        }

        @Test
        @DisplayName("should fall back to default limits and template for a partly filled settings row")
        void shouldFallBackToDefaults() {
            // Arrange
            AutomationSettings settings = AutomationSettings.builder()
                    .id(AutomationSettings.SINGLETON_ID)
                    .isAutoConfirm(true)
                    .build();
            when(orderRepository.findEscalationCandidates(eq(OrderStatus.COMPLETED), anyLong(), eq(5))).thenReturn(List.of(
                    Order.builder().marketplaceOrderId("AAAA0001").status(OrderStatus.COMPLETED).build()));
            when(funPaySupportApi.openSession()).thenReturn("session");
            when(funPaySupportApi.fetchCsrfToken("session")).thenReturn("csrf");
            when(funPaySupportApi.submitTicket(eq("session"), eq("csrf"), eq("SellerName"), eq("AAAA0001"), contains("#AAAA0001")))
                    .thenReturn("901");
            long before = System.currentTimeMillis();

            // Act
            int escalated = service.escalateCompletedOrders(settings);

            // Assert
            assertThat(escalated).isEqualTo(1);
            verify(orderRepository).findEscalationCandidates(eq(OrderStatus.COMPLETED),
                    longThat(cutoff -> cutoff <= before - 24L * 60L * 60L * 1000L + 1000L), eq(5));
        }
    }
}
