package com.recomart.product.controller;

import com.recomart.product.dto.ProductDTO;
import com.recomart.product.exception.ProductException;
import com.recomart.product.service.ProductService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ProductController.class)
class ProductControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    ProductService productService;

    @Test
    void getProductReturnsDto() throws Exception {
        when(productService.getProduct("P1001")).thenReturn(ProductDTO.builder()
                .productId("P1001")
                .name("Wireless Headphones")
                .price(new BigDecimal("99.99"))
                .tags(List.of("audio", "wireless", "bluetooth"))
                .build());

        mvc.perform(get("/api/products/P1001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Wireless Headphones"))
                .andExpect(jsonPath("$.tags[2]").value("bluetooth"));
    }

    @Test
    void unknownProductIsNotFound() throws Exception {
        when(productService.getProduct("nope")).thenThrow(ProductException.productNotFound("nope"));

        mvc.perform(get("/api/products/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("PRODUCT_NOT_FOUND"));
    }

    @Test
    void createReturnsCreated() throws Exception {
        when(productService.createProduct(any())).thenReturn(ProductDTO.builder()
                .productId("P1003")
                .name("Running Shoes")
                .build());

        mvc.perform(post("/api/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"productId": "P1003", "name": "Running Shoes", "price": 79.99,
                                 "category": "Sports", "tags": ["fitness", "running", "shoes"]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.productId").value("P1003"));
    }

    @Test
    void createWithoutPriceIsBadRequest() throws Exception {
        mvc.perform(post("/api/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\": \"P1003\", \"name\": \"Running Shoes\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.fieldErrors.price").value("Price is required"))
                .andExpect(jsonPath("$.fieldErrors.productId").doesNotExist())
                .andExpect(jsonPath("$.path").value("/api/products"));

        verify(productService, never()).createProduct(any());
    }

    @Test
    void oversizedBatchIsRejected() throws Exception {
        String ids = String.join(",", Collections.nCopies(101, "\"P1\""));

        mvc.perform(post("/api/products/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[" + ids + "]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BATCH_SIZE_EXCEEDED"));
    }

    @Test
    void deleteReturnsNoContent() throws Exception {
        mvc.perform(delete("/api/products/P1002"))
                .andExpect(status().isNoContent());

        verify(productService).deleteProduct("P1002");
    }
}
