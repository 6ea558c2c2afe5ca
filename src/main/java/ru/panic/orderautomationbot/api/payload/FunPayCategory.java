package ru.panic.orderautomationbot.api.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunPayCategory {
    private Long id;

    private String name;

    private List<FunPaySubcategory> subcategories;
}
