package com.recomart.customer.dto;

import com.recomart.common.enums.InteractionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordInteractionRequest {

    @NotBlank(message = "Product id is required")
    private String productId;

    @NotNull(message = "Interaction type is required")
    private InteractionType type;

    @PositiveOrZero(message = "Duration cannot be negative")
    private Integer durationSeconds;
}
