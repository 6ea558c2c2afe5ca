package ru.panic.orderautomationbot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.panic.orderautomationbot.api.FunPayApi;
import ru.panic.orderautomationbot.api.payload.FunPayAccountInfo;
import ru.panic.orderautomationbot.exception.MarketplaceApiException;
import ru.panic.orderautomationbot.model.StatsSnapshot;
import ru.panic.orderautomationbot.model.type.OrderStatus;
import ru.panic.orderautomationbot.repository.OrderRepository;
import ru.panic.orderautomationbot.repository.StatsSnapshotRepository;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class StatsService {
    static final List<String> ACTIVE_STATUSES = List.of(
            OrderStatus.AWAITING_DATA.name(),
            OrderStatus.DATA_COLLECTED.name(),
            OrderStatus.IN_PROGRESS.name());

    private final OrderRepository orderRepository;
    private final StatsSnapshotRepository statsSnapshotRepository;
    private final FunPayApi funPayApi;

    public StatsSnapshot takeSnapshot() {
        Double balance = null;
        String currency = null;

        try {
            FunPayAccountInfo account = funPayApi.getAccount();
            balance = account.getBalance();
            currency = account.getCurrency();
        } catch (MarketplaceApiException e) {
            log.warn(e.getMessage());
        }

        StatsSnapshot snapshot = StatsSnapshot.builder()
                .totalOrders(orderRepository.count())
                .activeOrders(orderRepository.countByStatusIn(ACTIVE_STATUSES))
                .balance(balance)
                .currency(currency)
                .createdAt(System.currentTimeMillis())
                .build();

        return statsSnapshotRepository.save(snapshot);
    }

    public long countActiveOrders() {
        return orderRepository.countByStatusIn(ACTIVE_STATUSES);
    }

    public long countOrders() {
        return orderRepository.count();
    }
}
