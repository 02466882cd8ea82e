package com.tartaritech.profit_dashboard.dtos;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class OrderSyncRequestDTO {

    @NotEmpty(message = "At least one order is required")
    @Valid
    private List<OrderDTO> orders;
}
