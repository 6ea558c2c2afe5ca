package ru.panic.orderautomationbot.repository;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.panic.orderautomationbot.model.event.ReviewReminderEvent;

import java.util.List;

@Repository
public interface ReviewReminderEventRepository extends CrudRepository<ReviewReminderEvent, Long> {
    @Query("SELECT e.* FROM review_reminder_events_table e WHERE e.fire_at <= :now ORDER BY e.fire_at ASC LIMIT :limit")
    List<ReviewReminderEvent> findDue(@Param("now") long now, @Param("limit") int limit);

    @Query("SELECT COUNT(*) FROM review_reminder_events_table WHERE marketplace_order_id = :marketplaceOrderId")
    long countByMarketplaceOrderId(@Param("marketplaceOrderId") String marketplaceOrderId);
}
