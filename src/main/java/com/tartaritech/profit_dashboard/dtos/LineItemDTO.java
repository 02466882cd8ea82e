package com.tartaritech.profit_dashboard.dtos;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tartaritech.profit_dashboard.entities.LineItem;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
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
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LineItemDTO {

    private String productId;

    private String variantId;

    @NotBlank(message = "Product title is required")
    private String productTitle;

    private String variantTitle;

    @Min(value = 0, message = "Quantity cannot be negative")
    private int quantity = 1;

    @JsonProperty("price")
    private BigDecimal unitPrice = BigDecimal.ZERO;

    private BigDecimal total;

    public LineItemDTO(LineItem entity) {
        this.productId = entity.getProductId();
        this.variantId = entity.getVariantId();
        this.productTitle = entity.getProductTitle();
        this.variantTitle = entity.getVariantTitle();
        this.quantity = entity.getQuantity();
        this.unitPrice = entity.getUnitPrice();
        this.total = entity.getTotal();
    }

    public LineItem toEntity() {
        BigDecimal price = unitPrice != null ? unitPrice : BigDecimal.ZERO;
        LineItem item = LineItem.create(productTitle, variantTitle, quantity, price);
        item.setProductId(productId);
        item.setVariantId(variantId);
        if (total != null) {
            item.setTotal(total);
        }
        return item;
    }
}
