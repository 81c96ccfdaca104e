package com.recomart.customer.dto;

import com.recomart.customer.entity.Purchase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PurchaseDTO {

    private Long id;
    private String customerId;
    private String productId;
    private Integer quantity;
    private BigDecimal amount;
    private LocalDateTime purchasedAt;

    public static PurchaseDTO fromEntity(Purchase purchase) {
        return PurchaseDTO.builder()
                .id(purchase.getId())
                .customerId(purchase.getCustomerId())
                .productId(purchase.getProductId())
                .quantity(purchase.getQuantity())
                .amount(purchase.getAmount())
                .purchasedAt(purchase.getPurchasedAt())
                .build();
    }
}
