package com.recomart.product.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateProductRequest {

    @NotBlank(message = "Product id is required")
    @Size(max = 64, message = "Product id must not exceed 64 characters")
    private String productId;

    @NotBlank(message = "Product name is required")
    private String name;

    private String category;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0.0", message = "Price cannot be negative")
    private BigDecimal price;

    @Size(max = 2000, message = "Description must not exceed 2000 characters")
    private String description;

    private List<String> tags;

    @PositiveOrZero(message = "Popularity score cannot be negative")
    private Double popularityScore;
}
