package com.shop.payments.orders;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A customer's checkout: which products, how many of each, and the tax and shipping to add.
 * Item prices are taken from the product records, never from the client.
 */
@Value
@Builder
public class CheckoutCommand {

    String userId;
    @Singular
    List<Line> lines;
    BigDecimal taxPrice;
    BigDecimal shippingPrice;
    String paymentMethod;

    @Value
    public static class Line {
        String productId;
        int quantity;
    }
}
