package com.shop.payments.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * Checkout request. Item prices are looked up server side.
 */
@Data
public class CreateOrderRequestDto {

    @NotEmpty(message = "No order items provided")
    @Valid
    private List<Item> orderItems;

    @DecimalMin(value = "0.00", message = "taxPrice must not be negative")
    private BigDecimal taxPrice;

    @DecimalMin(value = "0.00", message = "shippingPrice must not be negative")
    private BigDecimal shippingPrice;

    private String paymentMethod;

    @Data
    public static class Item {

        @NotBlank(message = "product is required")
        private String product;

        @Min(value = 1, message = "quantity must be at least 1")
        private int quantity;
    }
}
