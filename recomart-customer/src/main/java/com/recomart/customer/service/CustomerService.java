package com.recomart.customer.service;

import com.recomart.customer.dto.CustomerDTO;
import com.recomart.customer.dto.InteractionDTO;
import com.recomart.customer.dto.PurchaseDTO;
import com.recomart.customer.dto.RecordInteractionRequest;
import com.recomart.customer.dto.RecordPurchaseRequest;
import com.recomart.customer.dto.UpdateCustomerRequest;
import com.recomart.customer.entity.Customer;
import com.recomart.customer.entity.Interaction;
import com.recomart.customer.entity.Purchase;
import com.recomart.customer.exception.CustomerException;
import com.recomart.customer.repository.CustomerRepository;
import com.recomart.customer.repository.InteractionRepository;
import com.recomart.customer.repository.PurchaseRepository;
import com.recomart.product.service.ProductService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Customer profiles and the interaction/purchase activity log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerService {

    private final CustomerRepository customerRepository;
    private final InteractionRepository interactionRepository;
    private final PurchaseRepository purchaseRepository;
    private final ProductService productService;

    @Transactional(readOnly = true)
    public CustomerDTO getCustomer(String customerId) {
        return customerRepository.findByCustomerId(customerId)
                .map(CustomerDTO::fromEntity)
                .orElseThrow(() -> CustomerException.customerNotFound(customerId));
    }

    /**
     * Create the profile with defaults when it does not exist, otherwise apply the non-null fields.
     * Either way the customer's last activity is refreshed.
     */
    @Transactional
    public CustomerDTO updateProfile(String customerId, UpdateCustomerRequest request) {
        Customer customer = customerRepository.findByCustomerId(customerId)
                .orElse(null);

        if (customer == null) {
            customer = Customer.builder()
                    .customerId(customerId)
                    .name(request.getName() != null ? request.getName() : "")
                    .age(request.getAge())
                    .gender(request.getGender())
                    .location(request.getLocation())
                    .preferences(request.getPreferences() != null ? request.getPreferences() : "{}")
                    .build();
            log.info("Creating customer profile: customerId={}", customerId);
        } else {
            if (request.getName() != null) {
                customer.setName(request.getName());
            }
            if (request.getAge() != null) {
                customer.setAge(request.getAge());
            }
            if (request.getGender() != null) {
                customer.setGender(request.getGender());
            }
            if (request.getLocation() != null) {
                customer.setLocation(request.getLocation());
            }
            if (request.getPreferences() != null) {
                customer.setPreferences(request.getPreferences());
            }
            log.info("Updating customer profile: customerId={}", customerId);
        }

        customer.setLastActivity(LocalDateTime.now());
        customer = customerRepository.save(customer);
        return CustomerDTO.fromEntity(customer);
    }

    @Transactional
    public InteractionDTO recordInteraction(String customerId, RecordInteractionRequest request) {
        Customer customer = requireCustomer(customerId);
        requireProduct(request.getProductId());

        LocalDateTime now = LocalDateTime.now();
        Interaction interaction = Interaction.builder()
                .customerId(customerId)
                .productId(request.getProductId())
                .interactionType(request.getType())
                .occurredAt(now)
                .durationSeconds(request.getDurationSeconds() != null ? request.getDurationSeconds() : 0)
                .build();

        interaction = interactionRepository.save(interaction);
        customer.setLastActivity(now);

        log.debug("Recorded interaction: customerId={}, productId={}, type={}",
                customerId, request.getProductId(), request.getType());
        return InteractionDTO.fromEntity(interaction);
    }

    @Transactional
    public PurchaseDTO recordPurchase(String customerId, RecordPurchaseRequest request) {
        Customer customer = requireCustomer(customerId);
        requireProduct(request.getProductId());

        LocalDateTime now = LocalDateTime.now();
        Purchase purchase = Purchase.builder()
                .customerId(customerId)
                .productId(request.getProductId())
                .quantity(request.getQuantity())
                .amount(request.getAmount())
                .purchasedAt(now)
                .build();

        purchase = purchaseRepository.save(purchase);
        customer.setLastActivity(now);

        log.info("Recorded purchase: customerId={}, productId={}, quantity={}, amount={}",
                customerId, request.getProductId(), request.getQuantity(), request.getAmount());
        return PurchaseDTO.fromEntity(purchase);
    }

    @Transactional(readOnly = true)
    public List<InteractionDTO> getRecentInteractions(String customerId, int limit) {
        requireCustomer(customerId);
        return interactionRepository.findByCustomerIdOrderByOccurredAtDescIdDesc(customerId, PageRequest.of(0, limit))
                .stream()
                .map(InteractionDTO::fromEntity)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PurchaseDTO> getRecentPurchases(String customerId, int limit) {
        requireCustomer(customerId);
        return purchaseRepository.findByCustomerIdOrderByPurchasedAtDescIdDesc(customerId, PageRequest.of(0, limit))
                .stream()
                .map(PurchaseDTO::fromEntity)
                .toList();
    }

    private Customer requireCustomer(String customerId) {
        return customerRepository.findByCustomerId(customerId)
                .orElseThrow(() -> CustomerException.customerNotFound(customerId));
    }

    private void requireProduct(String productId) {
        if (!productService.existsByProductId(productId)) {
            throw CustomerException.productNotFound(productId);
        }
    }
}
