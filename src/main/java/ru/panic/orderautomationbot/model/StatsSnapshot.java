package ru.panic.orderautomationbot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Table(name = "stats_snapshots_table")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsSnapshot {
    @Id
    private Long id;

    @Column("total_orders")
    private Long totalOrders;

    @Column("active_orders")
    private Long activeOrders;

    private Double balance;

    private String currency;

    @Column("created_at")
    private Long createdAt;
}
