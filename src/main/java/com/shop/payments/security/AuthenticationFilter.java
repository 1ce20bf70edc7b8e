package com.shop.payments.security;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;

/**
 * Reads the bearer token and, when it is valid, stores the {@link AuthenticatedUser} as a
 * request attribute. Requests without a valid token pass through unauthenticated; endpoints
 * that need a user reject them through {@link CurrentUser}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthenticationFilter implements Filter {

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        String token = resolveToken(httpRequest);

        if (token != null) {
            if (jwtTokenProvider.validateToken(token)) {
                httpRequest.setAttribute(CurrentUser.ATTRIBUTE, jwtTokenProvider.parse(token));
            } else {
                log.debug("Rejected bearer token on {} {}", httpRequest.getMethod(), httpRequest.getRequestURI());
            }
        }
        chain.doFilter(request, response);
    }

    private String resolveToken(HttpServletRequest request) {
        String bearer = request.getHeader("Authorization");
        if (StringUtils.hasText(bearer) && bearer.startsWith("Bearer ")) {
            return bearer.substring(7);
        }
        return null;
    }
}
