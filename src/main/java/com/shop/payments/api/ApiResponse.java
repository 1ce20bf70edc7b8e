package com.shop.payments.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Uniform response envelope: {@code status} is "success" or "error", {@code message} is
 * human readable, {@code data} carries the payload.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    String status;
    String message;
    T data;
    Pagination pagination;
    Integer results;

    public static <T> ApiResponse<T> ok(String message, T data) {
        return ApiResponse.<T>builder().status(SUCCESS).message(message).data(data).build();
    }

    public static <T> ApiResponse<T> ok(T data) {
        return ok(null, data);
    }

    public static <T> ApiResponse<T> error(String message) {
        return ApiResponse.<T>builder().status(ERROR).message(message).build();
    }

    public static <T> ApiResponse<T> error(String message, T details) {
        return ApiResponse.<T>builder().status(ERROR).message(message).data(details).build();
    }

    @Value
    public static class Pagination {
        int page;
        int limit;
        long total;
        int pages;
    }
}
