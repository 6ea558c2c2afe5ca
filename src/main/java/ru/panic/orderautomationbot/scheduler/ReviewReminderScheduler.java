package ru.panic.orderautomationbot.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import ru.panic.orderautomationbot.model.event.ReviewReminderEvent;
import ru.panic.orderautomationbot.property.AutomationProperty;
import ru.panic.orderautomationbot.repository.ReviewReminderEventRepository;
import ru.panic.orderautomationbot.service.ReviewReminderService;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class ReviewReminderScheduler {
    private final ReviewReminderEventRepository reviewReminderEventRepository;
    private final ReviewReminderService reviewReminderService;
    private final AutomationProperty automationProperty;

    @Scheduled(fixedDelay = 5000)
    public void sendDueReminders() {
        List<ReviewReminderEvent> dueEvents =
                reviewReminderEventRepository.findDue(System.currentTimeMillis(), automationProperty.getReviewReminderBatchSize());

        for (ReviewReminderEvent event : dueEvents) {
            try {
                reviewReminderService.fire(event);
            } catch (RuntimeException e) {
                log.error("Review reminder for #{} failed", event.getMarketplaceOrderId(), e);
            }
        }
    }
}
