package com.shop.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Optional filters for payment listings. Null fields do not filter. */
@Value
@Builder
public class PaymentSearchCriteria {

    String userId;
    PaymentStatus status;
    Instant startDate;
    Instant endDate;
}
