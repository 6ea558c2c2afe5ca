package ru.panic.orderautomationbot.model.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Table(name = "review_reminder_events_table")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewReminderEvent {
    @Id
    private Long id;

    @Column("marketplace_order_id")
    private String marketplaceOrderId;

    @Column("fire_at")
    private Long fireAt;

    @Column("created_at")
    private Long createdAt;
}
