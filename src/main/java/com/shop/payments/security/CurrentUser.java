package com.shop.payments.security;

import com.shop.payments.api.ErrorCode;
import com.shop.payments.api.PaymentException;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Access to the user stored on the request by {@link AuthenticationFilter}.
 */
public final class CurrentUser {

    static final String ATTRIBUTE = "authenticatedUser";

    private CurrentUser() {}

    /** @throws PaymentException UNAUTHORIZED when the request carries no valid token */
    public static AuthenticatedUser require(HttpServletRequest request) {
        Object user = request.getAttribute(ATTRIBUTE);
        if (user instanceof AuthenticatedUser) {
            return (AuthenticatedUser) user;
        }
        throw new PaymentException(ErrorCode.UNAUTHORIZED, "Not authorized, no valid token");
    }

    /** @throws PaymentException FORBIDDEN when the user is not an admin */
    public static AuthenticatedUser requireAdmin(HttpServletRequest request) {
        AuthenticatedUser user = require(request);
        if (!user.isAdmin()) {
            throw new PaymentException(ErrorCode.FORBIDDEN, "Admin role required");
        }
        return user;
    }
}
