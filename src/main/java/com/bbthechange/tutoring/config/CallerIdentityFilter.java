package com.bbthechange.tutoring.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Picks up the caller's user id forwarded by the upstream gateway in the
 * {@value #USER_ID_HEADER} header and exposes it as the "userId" request
 * attribute and in the logging MDC. Authentication itself happens upstream.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CallerIdentityFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(CallerIdentityFilter.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ID_ATTRIBUTE = "userId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String userId = request.getHeader(USER_ID_HEADER);
        if (userId != null && !userId.trim().isEmpty()) {
            request.setAttribute(USER_ID_ATTRIBUTE, userId.trim());
            MDC.put(USER_ID_ATTRIBUTE, userId.trim());
        } else if (logger.isDebugEnabled()) {
            logger.debug("Request to {} without {} header", request.getRequestURI(), USER_ID_HEADER);
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(USER_ID_ATTRIBUTE);
        }
    }
}
