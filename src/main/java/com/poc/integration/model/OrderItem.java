package com.poc.integration.model;

import java.math.BigDecimal;

public record OrderItem(String product, BigDecimal price, int quantity) {

    public BigDecimal total() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}
