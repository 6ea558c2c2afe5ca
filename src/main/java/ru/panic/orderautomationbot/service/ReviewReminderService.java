package ru.panic.orderautomationbot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.panic.orderautomationbot.flow.LocalizedMessage;
import ru.panic.orderautomationbot.model.AutomationSettings;
import ru.panic.orderautomationbot.model.Order;
import ru.panic.orderautomationbot.model.event.ReviewReminderEvent;
import ru.panic.orderautomationbot.model.type.OrderStatus;
import ru.panic.orderautomationbot.repository.OrderRepository;
import ru.panic.orderautomationbot.repository.ReviewReminderEventRepository;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReviewReminderService {
    private final ReviewReminderEventRepository reviewReminderEventRepository;
    private final OrderRepository orderRepository;
    private final AutomationSettingsService automationSettingsService;
    private final BuyerMessageService buyerMessageService;

    /**
     * Records a reminder due {@code reviewDelaySeconds} from now. At most one pending reminder per order.
     */
    public void schedule(String marketplaceOrderId, AutomationSettings settings) {
        if (reviewReminderEventRepository.countByMarketplaceOrderId(marketplaceOrderId) > 0) {
            return;
        }

        long now = System.currentTimeMillis();
        int delaySeconds = settings.getReviewDelaySeconds() == null ? 3 : settings.getReviewDelaySeconds();

        reviewReminderEventRepository.save(ReviewReminderEvent.builder()
                .marketplaceOrderId(marketplaceOrderId)
                .fireAt(now + delaySeconds * 1000L)
                .createdAt(now)
                .build());

        log.info("Review reminder for #{} scheduled in {}s", marketplaceOrderId, delaySeconds);
    }

    /**
     * Sends the reminder if the order is still confirmed, then drops the record either way.
     *
     * @return whether the reminder went out
     */
    @Transactional
    public boolean fire(ReviewReminderEvent event) {
        Order order = orderRepository.findByMarketplaceOrderIdForUpdate(event.getMarketplaceOrderId()).orElse(null);
        boolean isSent = false;

        if (order != null && order.getStatus() == OrderStatus.CONFIRMED) {
            isSent = buyerMessageService.send(order.getChatId(), reminderText(), order.getBuyerLang());

            log.info("Review reminder for #{} sent: {}", event.getMarketplaceOrderId(), isSent);
        } else {
            log.info("Review reminder for #{} cancelled, order changed", event.getMarketplaceOrderId());
        }

        reviewReminderEventRepository.deleteById(event.getId());
        return isSent;
    }

    private LocalizedMessage reminderText() {
        AutomationSettings settings = automationSettingsService.get();
        LocalizedMessage builtIn = BuyerMessageService.statusMessage(BuyerMessageService.REVIEW_REMINDER).orElseThrow();

        return LocalizedMessage.of(trimmed(settings.getReviewMessageRu()), trimmed(settings.getReviewMessageEn()))
                .orElse(builtIn);
    }

    private static String trimmed(String text) {
        return text == null ? null : text.trim();
    }
}
