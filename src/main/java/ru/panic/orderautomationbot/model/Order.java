package ru.panic.orderautomationbot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;
import ru.panic.orderautomationbot.model.type.OrderStatus;

@Table(name = "orders_table")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    @Id
    private Long id;

    @Column("marketplace_order_id")
    private String marketplaceOrderId;

    @Column("buyer_id")
    private Long buyerId;

    @Column("buyer_username")
    private String buyerUsername;

    @Column("chat_id")
    private String chatId;

    private String description;

    private Double price;

    private String currency;

    private OrderStatus status;

    // null when no flow matched the order
    @Column("flow_id")
    private String flowId;

    @Column("lot_binding_id")
    private Long lotBindingId;

    // json {"step": "...", "data": {...}}
    @Column("flow_state")
    private String flowState;

    // json object of the fields collected by the flow
    @Column("collected_data")
    private String collectedData;

    @Column("buyer_lang")
    private String buyerLang;

    @Column("escalated_at")
    private Long escalatedAt;

    @Column("created_at")
    private Long createdAt;

    @Column("updated_at")
    private Long updatedAt;
}
