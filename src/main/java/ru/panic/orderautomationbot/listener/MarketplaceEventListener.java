package ru.panic.orderautomationbot.listener;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import ru.panic.orderautomationbot.api.FunPayApi;
import ru.panic.orderautomationbot.api.FunPayRunner;
import ru.panic.orderautomationbot.api.event.MarketplaceEvent;
import ru.panic.orderautomationbot.property.AutomationProperty;
import ru.panic.orderautomationbot.property.FunPayProperty;
import ru.panic.orderautomationbot.service.ListingCache;
import ru.panic.orderautomationbot.service.OrderEventHandler;
import ru.panic.orderautomationbot.service.ReconciliationService;

import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Long-running loop that polls the marketplace and hands every event to {@link OrderEventHandler},
 * one at a time and in the order received.
 */
@Component
@Slf4j
public class MarketplaceEventListener {
    private static final String THREAD_NAME = "marketplace-event-listener";

    private final FunPayApi funPayApi;
    private final FunPayRunner funPayRunner;
    private final OrderEventHandler orderEventHandler;
    private final ReconciliationService reconciliationService;
    private final ListingCache listingCache;
    private final ExecutorService executorService;
    private final FunPayProperty funPayProperty;
    private final AutomationProperty automationProperty;

    private volatile boolean isStopped;
    private volatile Thread thread;

    public MarketplaceEventListener(FunPayApi funPayApi, FunPayRunner funPayRunner, OrderEventHandler orderEventHandler, ReconciliationService reconciliationService, ListingCache listingCache, ExecutorService executorService, FunPayProperty funPayProperty, AutomationProperty automationProperty) {
        this.funPayApi = funPayApi;
        this.funPayRunner = funPayRunner;
        this.orderEventHandler = orderEventHandler;
        this.reconciliationService = reconciliationService;
        this.listingCache = listingCache;
        this.executorService = executorService;
        this.funPayProperty = funPayProperty;
        this.automationProperty = automationProperty;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        try {
            funPayApi.refresh();
        } catch (RuntimeException e) {
            log.error("Marketplace account not loaded, events will be polled anyway", e);
        }

        if (automationProperty.isReconcileOnStartup()) {
            reconciliationService.reconcile();
        }

        executorService.submit(() -> {
            try {
                listingCache.refresh();
            } catch (RuntimeException e) {
                log.warn("Listing cache not preloaded: {}", e.getMessage());
            }
        });

        Thread listenerThread = new Thread(this::run, THREAD_NAME);
        listenerThread.setDaemon(true);
        thread = listenerThread;
        listenerThread.start();

        log.info("Marketplace event listener started");
    }

    @PreDestroy
    public void stop() {
        isStopped = true;

        Thread listenerThread = thread;

        if (listenerThread != null) {
            listenerThread.interrupt();
        }
    }

    public boolean isRunning() {
        Thread listenerThread = thread;

        return !isStopped && listenerThread != null && listenerThread.isAlive();
    }

    void run() {
        while (!isStopped) {
            pollOnce();

            try {
                Thread.sleep(funPayProperty.getEventPollDelayMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        log.info("Marketplace event listener stopped");
    }

    /**
     * One poll of the runner. A failing event is logged and skipped, the rest of the batch is still handled.
     *
     * @return the number of events handled without an error
     */
    int pollOnce() {
        List<MarketplaceEvent> events;

        try {
            events = funPayRunner.poll();
        } catch (RuntimeException e) {
            log.error("Marketplace poll failed", e);
            return 0;
        }

        int handled = 0;

        for (MarketplaceEvent event : events) {
            try {
                orderEventHandler.handleEvent(event);
                handled++;
            } catch (RuntimeException e) {
                log.error("Event {} not handled", event.getClass().getSimpleName(), e);
            }
        }

        return handled;
    }
}
