package ru.panic.orderautomationbot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Table(name = "lot_bindings_table")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotBinding {
    @Id
    private Long id;

    @Column("flow_id")
    private String flowId;

    // json array of lowercase keywords, may be null
    private String keywords;

    // legacy exact match, may be null
    @Column("lot_id")
    private Long lotId;

    // legacy substring match, may be null
    @Column("lot_name_pattern")
    private String lotNamePattern;

    // json {"messageKey": {"ru": "...", "en": "..."}}, may be null
    @Column("custom_texts")
    private String customTexts;

    @Column("created_at")
    private Long createdAt;
}
