package ru.panic.orderautomationbot.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.panic.orderautomationbot.api.FunPayApi;
import ru.panic.orderautomationbot.api.FunPaySupportApi;
import ru.panic.orderautomationbot.bot.TelegramBot;
import ru.panic.orderautomationbot.exception.MarketplaceApiException;
import ru.panic.orderautomationbot.exception.SupportAuthorizationException;
import ru.panic.orderautomationbot.model.AutomationSettings;
import ru.panic.orderautomationbot.model.Order;
import ru.panic.orderautomationbot.model.type.OrderStatus;
import ru.panic.orderautomationbot.property.AutomationProperty;
import ru.panic.orderautomationbot.repository.OrderRepository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Asks marketplace support to confirm completed orders the buyers left unconfirmed.
 */
@Service
@Slf4j
public class SupportEscalationService {
    public static final String ORDER_IDS_PLACEHOLDER = "{order_ids}";
    public static final String ORDER_ID_PLACEHOLDER = "{order_id}";

    private final FunPaySupportApi funPaySupportApi;
    private final FunPayApi funPayApi;
    private final OrderRepository orderRepository;
    private final AutomationSettingsService automationSettingsService;
    private final TelegramBot telegramBot;
    private final AutomationProperty automationProperty;

    public SupportEscalationService(FunPaySupportApi funPaySupportApi, FunPayApi funPayApi, OrderRepository orderRepository, AutomationSettingsService automationSettingsService, TelegramBot telegramBot, AutomationProperty automationProperty) {
        this.funPaySupportApi = funPaySupportApi;
        this.funPayApi = funPayApi;
        this.orderRepository = orderRepository;
        this.automationSettingsService = automationSettingsService;
        this.telegramBot = telegramBot;
        this.automationProperty = automationProperty;
    }

    /**
     * Files one ticket. Session, CSRF token and submission are attempted up to
     * {@code automation.support-attempts} times, only authorization failures are retried.
     */
    public SupportTicketResult escalate(List<String> orderIds, String template, boolean isManual) {
        if (orderIds.isEmpty()) {
            return SupportTicketResult.failed();
        }

        List<String> ids = orderIds.stream()
                .map(id -> id.startsWith("#") ? id.substring(1) : id)
                .toList();
        String message = renderTemplate(template, ids, isManual);
        int attempts = Math.max(1, automationProperty.getSupportAttempts());

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                String sessionId = funPaySupportApi.openSession();
                String csrfToken = funPaySupportApi.fetchCsrfToken(sessionId);
                String ticketId = funPaySupportApi.submitTicket(sessionId, csrfToken, sellerUsername(), ids.get(0), message);

                log.info("Support ticket {} filed for orders {}", ticketId, ids);
                return new SupportTicketResult(true, ticketId);
            } catch (SupportAuthorizationException e) {
                log.warn("Support authorization failed, attempt {}/{}: {}", attempt, attempts, e.getMessage());

                if (attempt < attempts && !backoff()) {
                    break;
                }
            } catch (MarketplaceApiException e) {
                log.error("Support ticket for orders {} failed", ids, e);
                break;
            }
        }

        telegramBot.notifyOperator("⚠️ Не удалось отправить тикет в поддержку по заказам " + joinIds(ids));
        return SupportTicketResult.failed();
    }

    public SupportTicketResult escalate(List<String> orderIds) {
        return escalate(orderIds, automationSettingsService.get().getEscalationTemplate(), false);
    }

    public SupportTicketResult escalateManually(String orderId) {
        return escalate(List.of(orderId), automationSettingsService.get().getManualEscalationTemplate(), true);
    }

    /**
     * Escalates the oldest completed, not yet escalated orders in one ticket and stamps them on success.
     *
     * @return the number of orders escalated
     */
    public int escalateCompletedOrders(AutomationSettings settings) {
        AutomationSettings defaults = AutomationSettings.defaults();
        int minAgeHours = settings.getEscalationMinAgeHours() == null
                ? defaults.getEscalationMinAgeHours()
                : settings.getEscalationMinAgeHours();
        int maxOrders = settings.getAutoConfirmMaxOrders() == null
                ? defaults.getAutoConfirmMaxOrders()
                : settings.getAutoConfirmMaxOrders();
        String template = settings.getEscalationTemplate() == null
                ? defaults.getEscalationTemplate()
                : settings.getEscalationTemplate();

        long minAgeMillis = minAgeHours * 60L * 60L * 1000L;
        List<Order> candidates = orderRepository.findEscalationCandidates(
                OrderStatus.COMPLETED,
                System.currentTimeMillis() - minAgeMillis,
                maxOrders);

        if (candidates.isEmpty()) {
            return 0;
        }

        List<String> ids = candidates.stream()
                .map(Order::getMarketplaceOrderId)
                .toList();
        SupportTicketResult result = escalate(ids, template, false);

        if (!result.isSuccess()) {
            return 0;
        }

        orderRepository.updateEscalatedAtByMarketplaceOrderIdIn(System.currentTimeMillis(), ids);
        telegramBot.notifyOperator("📨 Тикет на подтверждение заказов " + joinIds(ids) + " отправлен"
                + (result.getTicketId().isEmpty() ? "" : " (#" + result.getTicketId() + ")"));
        return ids.size();
    }

    static String renderTemplate(String template, List<String> ids, boolean isManual) {
        if (isManual) {
            return template.replace(ORDER_ID_PLACEHOLDER, "#" + ids.get(0));
        }
        return template.replace(ORDER_IDS_PLACEHOLDER, joinIds(ids));
    }

    private static String joinIds(List<String> ids) {
        return ids.stream()
                .map(id -> "#" + id)
                .collect(Collectors.joining(", "));
    }

    private String sellerUsername() {
        try {
            return funPayApi.getAccount().getUsername();
        } catch (MarketplaceApiException e) {
            log.warn(e.getMessage());
            return "";
        }
    }

    private boolean backoff() {
        try {
            Thread.sleep(automationProperty.getSupportBackoffMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
