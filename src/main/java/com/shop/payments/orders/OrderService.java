package com.shop.payments.orders;

import com.shop.payments.api.ErrorCode;
import com.shop.payments.api.PaymentException;
import com.shop.payments.compliance.ComplianceAuditLogger;
import com.shop.payments.domain.OrderStatus;
import com.shop.payments.persistence.entity.OrderEntity;
import com.shop.payments.persistence.entity.OrderItem;
import com.shop.payments.persistence.entity.ProductEntity;
import com.shop.payments.persistence.repository.OrderRepository;
import com.shop.payments.persistence.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Order lifecycle outside of payment: checkout, reads, status changes and cancellation.
 * Paid state is never written here; that belongs to the payment resolver.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private static final Set<OrderStatus> CANCELLABLE = EnumSet.of(OrderStatus.PENDING, OrderStatus.PROCESSING);
    private static final Set<OrderStatus> OPEN = EnumSet.complementOf(EnumSet.of(OrderStatus.CANCELLED));

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final InventoryAdjuster inventoryAdjuster;
    private final ComplianceAuditLogger auditLogger;

    /**
     * Create an order and take its items out of stock. Any missing product or short stock
     * rolls back the whole checkout.
     */
    @Transactional
    public OrderEntity checkout(CheckoutCommand command) {
        if (command.getLines().isEmpty()) {
            throw new PaymentException(ErrorCode.VALIDATION_FAILED, "No order items provided");
        }
        List<OrderItem> items = new ArrayList<>();
        BigDecimal itemsPrice = BigDecimal.ZERO;
        for (CheckoutCommand.Line line : command.getLines()) {
            ProductEntity product = productRepository.findById(line.getProductId())
                    .orElseThrow(() -> new PaymentException(ErrorCode.PRODUCT_NOT_FOUND,
                            "Product not found: " + line.getProductId()));
            inventoryAdjuster.reserve(product.getId(), product.getName(), line.getQuantity());
            items.add(OrderItem.builder()
                    .productId(product.getId())
                    .name(product.getName())
                    .quantity(line.getQuantity())
                    .unitPrice(product.getPrice())
                    .build());
            itemsPrice = itemsPrice.add(product.getPrice().multiply(BigDecimal.valueOf(line.getQuantity())));
        }

        BigDecimal tax = money(command.getTaxPrice());
        BigDecimal shipping = money(command.getShippingPrice());
        itemsPrice = itemsPrice.setScale(2, RoundingMode.HALF_UP);
        OrderEntity order = OrderEntity.builder()
                .userId(command.getUserId())
                .items(items)
                .itemsPrice(itemsPrice)
                .taxPrice(tax)
                .shippingPrice(shipping)
                .totalPrice(itemsPrice.add(tax).add(shipping))
                .paymentMethod(command.getPaymentMethod())
                .build();
        OrderEntity saved = orderRepository.save(order);
        log.info("Order created: orderId={}, userId={}, lines={}, total={}",
                saved.getId(), saved.getUserId(), items.size(), saved.getTotalPrice());
        return saved;
    }

    @Transactional(readOnly = true)
    public OrderEntity get(String orderId, String requestingUserId, boolean admin) {
        OrderEntity order = load(orderId);
        if (!admin && !order.getUserId().equals(requestingUserId)) {
            throw new PaymentException(ErrorCode.FORBIDDEN, "Not authorized to view this order");
        }
        return order;
    }

    @Transactional(readOnly = true)
    public List<OrderEntity> listForUser(String userId) {
        return orderRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public List<OrderEntity> listAll() {
        return orderRepository.findAllByOrderByCreatedAtDesc();
    }

    /**
     * Admin status change. CANCELLED goes through {@link #cancel} so stock is restored;
     * DELIVERED stamps the delivery time. A cancelled order does not move again.
     */
    @Transactional
    public OrderEntity updateStatus(String orderId, OrderStatus status, String adminUserId) {
        if (status == OrderStatus.CANCELLED) {
            return cancel(orderId, adminUserId, true);
        }
        load(orderId);
        Instant now = Instant.now();
        int updated = status == OrderStatus.DELIVERED
                ? orderRepository.transitionToDelivered(orderId, OPEN, status, now, now)
                : orderRepository.transitionStatus(orderId, OPEN, status, now);
        if (updated == 0) {
            throw new PaymentException(ErrorCode.ORDER_NOT_CANCELLABLE, "Cancelled orders cannot change status");
        }
        log.info("Order status updated: orderId={}, status={}, by={}", orderId, status, adminUserId);
        return load(orderId);
    }

    /**
     * Cancel a PENDING or PROCESSING order and put its items back in stock. Only the caller
     * whose conditional update wins restores stock, so concurrent cancels restore it once.
     */
    @Transactional
    public OrderEntity cancel(String orderId, String requestingUserId, boolean admin) {
        OrderEntity order = load(orderId);
        if (!admin && !order.getUserId().equals(requestingUserId)) {
            throw new PaymentException(ErrorCode.FORBIDDEN, "Not authorized to cancel this order");
        }
        if (!CANCELLABLE.contains(order.getStatus())) {
            throw new PaymentException(ErrorCode.ORDER_NOT_CANCELLABLE);
        }
        List<OrderItem> items = new ArrayList<>(order.getItems());

        int updated = orderRepository.transitionStatus(orderId, CANCELLABLE, OrderStatus.CANCELLED, Instant.now());
        if (updated == 0) {
            throw new PaymentException(ErrorCode.ORDER_NOT_CANCELLABLE);
        }
        inventoryAdjuster.release(items);
        if (order.isPaid()) {
            log.warn("Paid order {} was cancelled; the payment needs a manual refund", orderId);
        }
        auditLogger.logOrderCancelled(orderId, requestingUserId, items.size());
        return load(orderId);
    }

    private OrderEntity load(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new PaymentException(ErrorCode.ORDER_NOT_FOUND, "Order not found: " + orderId));
    }

    private static BigDecimal money(BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);
        }
        if (value.signum() < 0) {
            throw new PaymentException(ErrorCode.VALIDATION_FAILED, "Prices must not be negative");
        }
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
