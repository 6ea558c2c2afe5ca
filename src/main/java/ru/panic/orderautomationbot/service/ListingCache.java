package ru.panic.orderautomationbot.service;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.panic.orderautomationbot.api.FunPayApi;
import ru.panic.orderautomationbot.api.payload.FunPayCategory;
import ru.panic.orderautomationbot.api.payload.FunPayLot;
import ru.panic.orderautomationbot.api.payload.FunPaySubcategory;
import ru.panic.orderautomationbot.property.AutomationProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The seller's own lots per category and subcategory, reloaded when older than
 * {@code automation.listing-cache-ttl-seconds} or on {@link #refresh()}.
 */
@Component
@Slf4j
public class ListingCache {
    private final FunPayApi funPayApi;
    private final AutomationProperty automationProperty;
    private volatile List<CategoryListing> listings;
    private volatile long loadedAt;

    public ListingCache(FunPayApi funPayApi, AutomationProperty automationProperty) {
        this.funPayApi = funPayApi;
        this.automationProperty = automationProperty;
    }

    public List<CategoryListing> get() {
        List<CategoryListing> current = listings;

        if (current == null || System.currentTimeMillis() - loadedAt > automationProperty.getListingCacheTtlSeconds() * 1000L) {
            return refresh();
        }

        return current;
    }

    /**
     * Probes every subcategory of every category. A subcategory whose page fails counts as having no lots.
     */
    public synchronized List<CategoryListing> refresh() {
        List<CategoryListing> loaded = new ArrayList<>();

        for (FunPayCategory category : funPayApi.getCategories()) {
            Map<Long, List<FunPayLot>> lotsBySubcategory = new LinkedHashMap<>();

            for (FunPaySubcategory subcategory : category.getSubcategories()) {
                try {
                    lotsBySubcategory.put(subcategory.getId(), funPayApi.getMySubcategoryLots(subcategory.getId()));
                } catch (RuntimeException e) {
                    log.warn("Lots of subcategory {} not loaded: {}", subcategory.getId(), e.getMessage());
                    lotsBySubcategory.put(subcategory.getId(), Collections.emptyList());
                }
            }

            loaded.add(new CategoryListing(category, lotsBySubcategory));
        }

        listings = Collections.unmodifiableList(loaded);
        loadedAt = System.currentTimeMillis();

        log.info("Listing cache loaded: {} categories", loaded.size());
        return listings;
    }

    @Value
    public static class CategoryListing {
        FunPayCategory category;

        Map<Long, List<FunPayLot>> lotsBySubcategory;

        public List<Long> subcategoriesWithLots() {
            return lotsBySubcategory.entrySet().stream()
                    .filter(entry -> !entry.getValue().isEmpty())
                    .map(Map.Entry::getKey)
                    .toList();
        }

        public int lotCount() {
            return lotsBySubcategory.values().stream()
                    .mapToInt(List::size)
                    .sum();
        }
    }
}
