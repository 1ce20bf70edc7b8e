package com.shop.payments.api;

import com.shop.payments.orders.CheckoutCommand;
import com.shop.payments.orders.OrderService;
import com.shop.payments.persistence.entity.OrderEntity;
import com.shop.payments.security.AuthenticatedUser;
import com.shop.payments.security.CurrentUser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for checkout and order management.
 */
@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
@Tag(name = "Orders", description = "Checkout, order status and cancellation")
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    @Operation(summary = "Create order", description = "Checks stock, reserves it and creates an unpaid order.")
    public ResponseEntity<ApiResponse<Map<String, OrderResponseDto>>> create(
            @Valid @RequestBody CreateOrderRequestDto dto, HttpServletRequest httpRequest) {
        AuthenticatedUser user = CurrentUser.require(httpRequest);
        CheckoutCommand.CheckoutCommandBuilder command = CheckoutCommand.builder()
                .userId(user.getUserId())
                .taxPrice(dto.getTaxPrice())
                .shippingPrice(dto.getShippingPrice())
                .paymentMethod(dto.getPaymentMethod());
        for (CreateOrderRequestDto.Item item : dto.getOrderItems()) {
            command.line(new CheckoutCommand.Line(item.getProduct(), item.getQuantity()));
        }
        OrderEntity order = orderService.checkout(command.build());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok("Order created", Map.of("order", OrderResponseDto.from(order))));
    }

    @GetMapping
    @Operation(summary = "My orders")
    public ResponseEntity<ApiResponse<Map<String, List<OrderResponseDto>>>> mine(HttpServletRequest httpRequest) {
        AuthenticatedUser user = CurrentUser.require(httpRequest);
        return ResponseEntity.ok(listing(orderService.listForUser(user.getUserId())));
    }

    @GetMapping("/all")
    @Operation(summary = "All orders (admin)")
    public ResponseEntity<ApiResponse<Map<String, List<OrderResponseDto>>>> all(HttpServletRequest httpRequest) {
        CurrentUser.requireAdmin(httpRequest);
        return ResponseEntity.ok(listing(orderService.listAll()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get order", description = "For the order's owner or an admin.")
    public ResponseEntity<ApiResponse<Map<String, OrderResponseDto>>> get(
            @PathVariable String id, HttpServletRequest httpRequest) {
        AuthenticatedUser user = CurrentUser.require(httpRequest);
        OrderEntity order = orderService.get(id, user.getUserId(), user.isAdmin());
        return ResponseEntity.ok(ApiResponse.ok(Map.of("order", OrderResponseDto.from(order))));
    }

    @PutMapping("/{id}/status")
    @Operation(summary = "Update order status (admin)",
            description = "DELIVERED stamps the delivery time; CANCELLED restores stock.")
    public ResponseEntity<ApiResponse<Map<String, OrderResponseDto>>> updateStatus(
            @PathVariable String id, @Valid @RequestBody UpdateOrderStatusRequestDto dto,
            HttpServletRequest httpRequest) {
        AuthenticatedUser admin = CurrentUser.requireAdmin(httpRequest);
        OrderEntity order = orderService.updateStatus(id, dto.getStatus(), admin.getUserId());
        return ResponseEntity.ok(ApiResponse.ok(Map.of("order", OrderResponseDto.from(order))));
    }

    @PutMapping("/{id}/cancel")
    @Operation(summary = "Cancel order", description = "Pending or processing orders only; restores stock.")
    public ResponseEntity<ApiResponse<Map<String, OrderResponseDto>>> cancel(
            @PathVariable String id, HttpServletRequest httpRequest) {
        AuthenticatedUser user = CurrentUser.require(httpRequest);
        OrderEntity order = orderService.cancel(id, user.getUserId(), user.isAdmin());
        return ResponseEntity.ok(ApiResponse.ok("Order cancelled", Map.of("order", OrderResponseDto.from(order))));
    }

    private static ApiResponse<Map<String, List<OrderResponseDto>>> listing(List<OrderEntity> orders) {
        List<OrderResponseDto> items = orders.stream().map(OrderResponseDto::from).toList();
        return ApiResponse.<Map<String, List<OrderResponseDto>>>builder()
                .status(ApiResponse.SUCCESS)
                .results(items.size())
                .data(Map.of("orders", items))
                .build();
    }
}
