package ru.panic.orderautomationbot.api.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunPayLot {
    private Long id;

    private Long subcategoryId;

    private String description;

    private Double price;
}
