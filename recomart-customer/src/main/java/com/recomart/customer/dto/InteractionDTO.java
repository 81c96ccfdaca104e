package com.recomart.customer.dto;

import com.recomart.common.enums.InteractionType;
import com.recomart.customer.entity.Interaction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionDTO {

    private Long id;
    private String customerId;
    private String productId;
    private InteractionType type;
    private LocalDateTime occurredAt;
    private Integer durationSeconds;

    public static InteractionDTO fromEntity(Interaction interaction) {
        return InteractionDTO.builder()
                .id(interaction.getId())
                .customerId(interaction.getCustomerId())
                .productId(interaction.getProductId())
                .type(interaction.getInteractionType())
                .occurredAt(interaction.getOccurredAt())
                .durationSeconds(interaction.getDurationSeconds())
                .build();
    }
}
