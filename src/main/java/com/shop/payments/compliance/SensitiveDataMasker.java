package com.shop.payments.compliance;

/**
 * Redacts customer data so it is safe to include in logs.
 */
public final class SensitiveDataMasker {

    private SensitiveDataMasker() {}

    /** "jane.doe@example.com" -> "j***@example.com"; values without '@' are fully masked. */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) return null;
        int at = email.indexOf('@');
        if (at <= 0) return "***";
        return email.charAt(0) + "***" + email.substring(at);
    }

    /** Keeps the first and last four characters of a gateway access code or token. */
    public static String maskToken(String token) {
        if (token == null || token.isBlank()) return null;
        if (token.length() <= 8) return "****";
        return token.substring(0, 4) + "****" + token.substring(token.length() - 4);
    }
}
