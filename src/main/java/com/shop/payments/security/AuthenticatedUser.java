package com.shop.payments.security;

import lombok.Value;

/** The caller behind a valid bearer token. */
@Value
public class AuthenticatedUser {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ADMIN = "admin";

    String userId;
    String role;

    public boolean isAdmin() {
        return ROLE_ADMIN.equals(role);
    }
}
