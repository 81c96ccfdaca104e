package com.recomart.customer.dto;

import com.recomart.customer.entity.Customer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerDTO {

    private String customerId;
    private String name;
    private Integer age;
    private String gender;
    private String location;
    private String segment;
    private String preferences;
    private LocalDateTime lastActivity;
    private LocalDateTime createdAt;

    public static CustomerDTO fromEntity(Customer customer) {
        return CustomerDTO.builder()
                .customerId(customer.getCustomerId())
                .name(customer.getName())
                .age(customer.getAge())
                .gender(customer.getGender())
                .location(customer.getLocation())
                .segment(customer.getSegment())
                .preferences(customer.getPreferences())
                .lastActivity(customer.getLastActivity())
                .createdAt(customer.getCreatedAt())
                .build();
    }
}
