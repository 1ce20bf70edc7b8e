package com.shop.payments.api;

import com.shop.payments.domain.OrderStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class UpdateOrderStatusRequestDto {

    @NotNull(message = "status is required")
    private OrderStatus status;
}
