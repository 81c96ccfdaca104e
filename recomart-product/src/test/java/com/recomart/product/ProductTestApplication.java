package com.recomart.product;

import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProductTestApplication {
}
