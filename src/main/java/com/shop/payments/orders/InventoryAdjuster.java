package com.shop.payments.orders;

import com.shop.payments.api.ErrorCode;
import com.shop.payments.api.PaymentException;
import com.shop.payments.persistence.entity.OrderItem;
import com.shop.payments.persistence.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Moves product stock for checkout and cancellation. Must run inside the caller's transaction
 * so that a failed line rolls back the lines reserved before it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InventoryAdjuster {

    private final ProductRepository productRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public void reserve(String productId, String productName, int quantity) {
        int updated = productRepository.decrementStock(productId, quantity);
        if (updated == 0) {
            throw new PaymentException(ErrorCode.INSUFFICIENT_STOCK,
                    "Insufficient stock for product: " + productName);
        }
        log.debug("Reserved stock productId={} quantity={}", productId, quantity);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void release(List<OrderItem> items) {
        for (OrderItem item : items) {
            int updated = productRepository.incrementStock(item.getProductId(), item.getQuantity());
            if (updated == 0) {
                log.warn("Product {} no longer exists; {} units not restored", item.getProductId(), item.getQuantity());
            }
        }
    }
}
