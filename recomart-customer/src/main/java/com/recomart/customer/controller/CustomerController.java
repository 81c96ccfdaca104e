package com.recomart.customer.controller;

import com.recomart.customer.dto.CustomerDTO;
import com.recomart.customer.dto.InteractionDTO;
import com.recomart.customer.dto.PurchaseDTO;
import com.recomart.customer.dto.RecordInteractionRequest;
import com.recomart.customer.dto.RecordPurchaseRequest;
import com.recomart.customer.dto.UpdateCustomerRequest;
import com.recomart.customer.service.CustomerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
public class CustomerController {

    private final CustomerService customerService;

    @GetMapping("/{customerId}")
    public ResponseEntity<CustomerDTO> getCustomer(@PathVariable String customerId) {
        return ResponseEntity.ok(customerService.getCustomer(customerId));
    }

    @PutMapping("/{customerId}")
    public ResponseEntity<CustomerDTO> updateProfile(
            @PathVariable String customerId,
            @Valid @RequestBody UpdateCustomerRequest request) {
        return ResponseEntity.ok(customerService.updateProfile(customerId, request));
    }

    @PostMapping("/{customerId}/interactions")
    public ResponseEntity<InteractionDTO> recordInteraction(
            @PathVariable String customerId,
            @Valid @RequestBody RecordInteractionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(customerService.recordInteraction(customerId, request));
    }

    @GetMapping("/{customerId}/interactions")
    public ResponseEntity<List<InteractionDTO>> getRecentInteractions(
            @PathVariable String customerId,
            @RequestParam(defaultValue = "20") int limit) {
        limit = Math.max(1, Math.min(limit, 100));
        return ResponseEntity.ok(customerService.getRecentInteractions(customerId, limit));
    }

    @PostMapping("/{customerId}/purchases")
    public ResponseEntity<PurchaseDTO> recordPurchase(
            @PathVariable String customerId,
            @Valid @RequestBody RecordPurchaseRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(customerService.recordPurchase(customerId, request));
    }

    @GetMapping("/{customerId}/purchases")
    public ResponseEntity<List<PurchaseDTO>> getRecentPurchases(
            @PathVariable String customerId,
            @RequestParam(defaultValue = "20") int limit) {
        limit = Math.max(1, Math.min(limit, 100));
        return ResponseEntity.ok(customerService.getRecentPurchases(customerId, limit));
    }
}
