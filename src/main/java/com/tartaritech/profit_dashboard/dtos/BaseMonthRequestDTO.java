package com.tartaritech.profit_dashboard.dtos;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class BaseMonthRequestDTO {

    @NotNull(message = "Index is required")
    @Min(value = 0, message = "Index cannot be negative")
    private Integer index;
}
