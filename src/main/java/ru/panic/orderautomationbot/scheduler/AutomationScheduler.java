package ru.panic.orderautomationbot.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import ru.panic.orderautomationbot.api.FunPayApi;
import ru.panic.orderautomationbot.listener.MarketplaceEventListener;
import ru.panic.orderautomationbot.model.AutomationSettings;
import ru.panic.orderautomationbot.service.AutomationSettingsService;
import ru.panic.orderautomationbot.service.ListingCache;
import ru.panic.orderautomationbot.service.StatsService;
import ru.panic.orderautomationbot.service.SupportEscalationService;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Heartbeat, listing bump, stats snapshot and daily auto-escalation. Each routine keeps its own last-run time
 * and fails on its own.
 */
@Component
@Slf4j
public class AutomationScheduler {
    private static final LocalTime DEFAULT_AUTO_CONFIRM_TIME = LocalTime.NOON;

    private final FunPayApi funPayApi;
    private final ListingCache listingCache;
    private final StatsService statsService;
    private final SupportEscalationService supportEscalationService;
    private final AutomationSettingsService automationSettingsService;
    private final MarketplaceEventListener marketplaceEventListener;

    private long lastHeartbeatAt;
    private long lastBumpAt;
    private long lastStatsAt;
    private LocalDate lastEscalationDate;

    public AutomationScheduler(FunPayApi funPayApi, ListingCache listingCache, StatsService statsService, SupportEscalationService supportEscalationService, AutomationSettingsService automationSettingsService, MarketplaceEventListener marketplaceEventListener) {
        this.funPayApi = funPayApi;
        this.listingCache = listingCache;
        this.statsService = statsService;
        this.supportEscalationService = supportEscalationService;
        this.automationSettingsService = automationSettingsService;
        this.marketplaceEventListener = marketplaceEventListener;
    }

    @Scheduled(fixedDelay = 30000)
    public void tick() {
        if (!marketplaceEventListener.isRunning()) {
            return;
        }

        tick(System.currentTimeMillis(), LocalDateTime.now());
    }

    void tick(long nowMillis, LocalDateTime localNow) {
        AutomationSettings settings = automationSettingsService.get();

        if (Boolean.TRUE.equals(settings.getIsEternalOnline())
                && isDue(lastHeartbeatAt, settings.getHeartbeatIntervalSeconds(), nowMillis)) {
            lastHeartbeatAt = nowMillis;
            heartbeat();
        }

        if (Boolean.TRUE.equals(settings.getIsAutoBump())
                && isDue(lastBumpAt, settings.getBumpIntervalSeconds(), nowMillis)) {
            lastBumpAt = nowMillis;
            bump();
        }

        if (isDue(lastStatsAt, settings.getStatsIntervalSeconds(), nowMillis)) {
            lastStatsAt = nowMillis;
            takeStats();
        }

        if (Boolean.TRUE.equals(settings.getIsAutoConfirm())
                && !localNow.toLocalDate().equals(lastEscalationDate)
                && !localNow.toLocalTime().isBefore(autoConfirmTime(settings))) {
            lastEscalationDate = localNow.toLocalDate();
            escalate(settings);
        }
    }

    /**
     * @return the number of categories raised
     */
    int bump() {
        int raised = 0;

        try {
            for (ListingCache.CategoryListing listing : listingCache.refresh()) {
                List<Long> subcategoryIds = listing.subcategoriesWithLots();

                if (subcategoryIds.isEmpty()) {
                    continue;
                }

                try {
                    funPayApi.raiseLots(listing.getCategory().getId(), subcategoryIds);
                    raised++;
                } catch (RuntimeException e) {
                    log.warn("Lots of category {} not raised: {}", listing.getCategory().getName(), e.getMessage());
                }
            }

            log.info("Lots raised in {} categories", raised);
        } catch (RuntimeException e) {
            log.error("Listing bump failed", e);
        }

        return raised;
    }

    private void heartbeat() {
        try {
            funPayApi.refresh();
            log.debug("Heartbeat sent");
        } catch (RuntimeException e) {
            log.error("Heartbeat failed", e);
        }
    }

    private void takeStats() {
        try {
            statsService.takeSnapshot();
        } catch (RuntimeException e) {
            log.error("Stats snapshot failed", e);
        }
    }

    private void escalate(AutomationSettings settings) {
        try {
            int escalated = supportEscalationService.escalateCompletedOrders(settings);
            log.info("Auto-escalation done, {} orders", escalated);
        } catch (RuntimeException e) {
            log.error("Auto-escalation failed", e);
        }
    }

    private static boolean isDue(long lastRunAt, Integer intervalSeconds, long nowMillis) {
        if (intervalSeconds == null || intervalSeconds <= 0) {
            return false;
        }

        return lastRunAt == 0 || nowMillis - lastRunAt >= intervalSeconds * 1000L;
    }

    private static LocalTime autoConfirmTime(AutomationSettings settings) {
        if (settings.getAutoConfirmTime() == null) {
            return DEFAULT_AUTO_CONFIRM_TIME;
        }

        try {
            return LocalTime.parse(settings.getAutoConfirmTime().trim());
        } catch (DateTimeParseException e) {
            log.warn("Malformed auto-confirm time {}, using {}", settings.getAutoConfirmTime(), DEFAULT_AUTO_CONFIRM_TIME);
            return DEFAULT_AUTO_CONFIRM_TIME;
        }
    }
}
