package com.tartaritech.profit_dashboard.dtos;

import java.math.BigDecimal;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProfileTestRequestDTO {

    @NotNull(message = "Profile is required")
    @Valid
    private ShippingProfileDTO profile;

    @NotNull(message = "Test data is required")
    @Valid
    private TestData testData;

    @AllArgsConstructor
    @NoArgsConstructor
    @Getter
    @Setter
    @ToString
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class TestData {
        private String productTitle;
        private String variantTitle;
        @Min(value = 0, message = "Quantity cannot be negative")
        private Integer quantity = 1;
        private BigDecimal orderSubtotal = BigDecimal.ZERO;
        private BigDecimal shippingCharged = BigDecimal.ZERO;
    }
}
