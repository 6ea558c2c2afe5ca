package ru.panic.orderautomationbot.repository;

import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.panic.orderautomationbot.model.Order;
import ru.panic.orderautomationbot.model.type.OrderStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface OrderRepository extends CrudRepository<Order, Long> {
    @Query("SELECT o.* FROM orders_table o WHERE o.marketplace_order_id = :marketplaceOrderId")
    Optional<Order> findByMarketplaceOrderId(@Param("marketplaceOrderId") String marketplaceOrderId);

    @Query("SELECT o.* FROM orders_table o WHERE o.marketplace_order_id = :marketplaceOrderId FOR UPDATE")
    Optional<Order> findByMarketplaceOrderIdForUpdate(@Param("marketplaceOrderId") String marketplaceOrderId);

    @Query("SELECT COUNT(*) FROM orders_table WHERE marketplace_order_id = :marketplaceOrderId")
    long countByMarketplaceOrderId(@Param("marketplaceOrderId") String marketplaceOrderId);

    @Query("SELECT o.* FROM orders_table o WHERE o.chat_id = :chatId AND o.status = :status"
            + " ORDER BY o.created_at DESC, o.id DESC LIMIT 1")
    Optional<Order> findLatestByChatIdAndStatus(@Param("chatId") String chatId,
                                                @Param("status") OrderStatus status);

    @Query("SELECT o.* FROM orders_table o WHERE o.buyer_id = :buyerId AND o.status = :status"
            + " ORDER BY o.created_at DESC, o.id DESC LIMIT 1")
    Optional<Order> findLatestByBuyerIdAndStatus(@Param("buyerId") long buyerId,
                                                 @Param("status") OrderStatus status);

    @Query("SELECT o.* FROM orders_table o ORDER BY o.created_at DESC, o.id DESC LIMIT :limit")
    List<Order> findLatest(@Param("limit") int limit);

    @Query("SELECT COUNT(*) FROM orders_table WHERE status IN (:statuses)")
    long countByStatusIn(@Param("statuses") Collection<String> statuses);

    @Query("SELECT o.* FROM orders_table o WHERE o.status = :status AND o.escalated_at IS NULL"
            + " AND o.updated_at <= :updatedBefore ORDER BY o.updated_at ASC LIMIT :limit")
    List<Order> findEscalationCandidates(@Param("status") OrderStatus status,
                                         @Param("updatedBefore") long updatedBefore,
                                         @Param("limit") int limit);

    @Query("UPDATE orders_table SET escalated_at = :escalatedAt WHERE marketplace_order_id IN (:marketplaceOrderIds)")
    @Modifying
    void updateEscalatedAtByMarketplaceOrderIdIn(@Param("escalatedAt") long escalatedAt,
                                                 @Param("marketplaceOrderIds") Collection<String> marketplaceOrderIds);
}
