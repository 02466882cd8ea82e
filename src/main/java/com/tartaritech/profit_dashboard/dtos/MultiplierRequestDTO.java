package com.tartaritech.profit_dashboard.dtos;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class MultiplierRequestDTO {

    @NotNull(message = "Multiplier is required")
    @DecimalMin(value = "0.0", message = "Multiplier cannot be negative")
    private Double value;
}
