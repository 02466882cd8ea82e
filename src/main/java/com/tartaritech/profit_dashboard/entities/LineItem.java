package com.tartaritech.profit_dashboard.entities;

import java.math.BigDecimal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Entity
@ToString(exclude = "order")
@Table(name = "tb_line_item")
public class LineItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String productId;

    private String variantId;

    @Column(nullable = false)
    private String productTitle;

    private String variantTitle;

    @Column(nullable = false)
    private Integer quantity = 1;

    @Column(precision = 19, scale = 2)
    private BigDecimal unitPrice = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal total = BigDecimal.ZERO;

    @ManyToOne
    @JoinColumn(name = "order_id")
    private Order order;

    public static LineItem create(String productTitle, String variantTitle, int quantity, BigDecimal unitPrice) {
        LineItem item = new LineItem();
        item.setProductTitle(productTitle);
        item.setVariantTitle(variantTitle);
        item.setQuantity(quantity);
        item.setUnitPrice(unitPrice);
        item.setTotal(unitPrice.multiply(BigDecimal.valueOf(quantity)));
        return item;
    }
}
