package com.shop.payments.api;

import com.shop.payments.domain.PaymentSearchCriteria;
import com.shop.payments.domain.PaymentStatus;
import org.springframework.data.domain.Page;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Validation and parsing of the query parameters shared by the payment listings.
 */
final class ListingParams {

    static final int MAX_LIMIT = 100;

    private ListingParams() {}

    static void checkPage(int page, int limit) {
        if (page < 1) {
            throw new PaymentException(ErrorCode.VALIDATION_FAILED, "page must be at least 1");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new PaymentException(ErrorCode.VALIDATION_FAILED, "limit must be between 1 and " + MAX_LIMIT);
        }
    }

    static PaymentSearchCriteria criteria(String userId, String status, String startDate, String endDate) {
        Instant start = parseDate(startDate, "startDate", false);
        Instant end = parseDate(endDate, "endDate", true);
        if (start != null && end != null && end.isBefore(start)) {
            throw new PaymentException(ErrorCode.VALIDATION_FAILED, "endDate must not be before startDate");
        }
        return PaymentSearchCriteria.builder()
                .userId(userId)
                .status(parseStatus(status))
                .startDate(start)
                .endDate(end)
                .build();
    }

    static ApiResponse.Pagination pagination(Page<?> page, int pageNumber, int limit) {
        return new ApiResponse.Pagination(pageNumber, limit, page.getTotalElements(), page.getTotalPages());
    }

    private static PaymentStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return PaymentStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new PaymentException(ErrorCode.VALIDATION_FAILED,
                    "status must be one of pending, success, failed, abandoned");
        }
    }

    /** Accepts a full ISO-8601 timestamp or a plain date; a plain end date covers the whole day. */
    private static Instant parseDate(String value, String name, boolean endOfDay) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            if (value.contains("T")) {
                return OffsetDateTime.parse(value).toInstant();
            }
            LocalDate date = LocalDate.parse(value);
            return endOfDay
                    ? date.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC).minusMillis(1)
                    : date.atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new PaymentException(ErrorCode.VALIDATION_FAILED, name + " must be an ISO-8601 date");
        }
    }
}
