package ru.panic.orderautomationbot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Singleton row (id = 1) with the toggles and parameters of the background routines.
 */
@Table(name = "automation_settings_table")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutomationSettings {
    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column("eternal_online")
    private Boolean isEternalOnline;

    @Column("heartbeat_interval_seconds")
    private Integer heartbeatIntervalSeconds;

    @Column("auto_bump")
    private Boolean isAutoBump;

    @Column("bump_interval_seconds")
    private Integer bumpIntervalSeconds;

    @Column("stats_interval_seconds")
    private Integer statsIntervalSeconds;

    @Column("review_reminder")
    private Boolean isReviewReminder;

    @Column("review_delay_seconds")
    private Integer reviewDelaySeconds;

    @Column("review_message_ru")
    private String reviewMessageRu;

    @Column("review_message_en")
    private String reviewMessageEn;

    @Column("auto_confirm")
    private Boolean isAutoConfirm;

    // HH:mm, server local time
    @Column("auto_confirm_time")
    private String autoConfirmTime;

    @Column("auto_confirm_max_orders")
    private Integer autoConfirmMaxOrders;

    @Column("escalation_min_age_hours")
    private Integer escalationMinAgeHours;

    // must contain {order_ids}
    @Column("escalation_template")
    private String escalationTemplate;

    // must contain {order_id}
    @Column("manual_escalation_template")
    private String manualEscalationTemplate;

    public static AutomationSettings defaults() {
        return AutomationSettings.builder()
                .id(SINGLETON_ID)
                .isEternalOnline(true)
                .heartbeatIntervalSeconds(60 * 4)
                .isAutoBump(true)
                .bumpIntervalSeconds(60 * 60 * 4)
                .statsIntervalSeconds(60 * 60)
                .isReviewReminder(true)
                .reviewDelaySeconds(60 * 60 * 24)
                .reviewMessageRu(null)
                .reviewMessageEn(null)
                .isAutoConfirm(false)
                .autoConfirmTime("12:00")
                .autoConfirmMaxOrders(5)
                .escalationMinAgeHours(24)
                .escalationTemplate("Здравствуйте! Прошу подтвердить заказы {order_ids}. "
                        + "Заказы выполнены, покупатели не отвечают.")
                .manualEscalationTemplate("Здравствуйте! Прошу подтвердить заказ {order_id}. "
                        + "Заказ выполнен, покупатель не отвечает.")
                .build();
    }
}
