package com.github.dimitryivaniuta.governance.web;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with a correlation id (taken from {@code X-Correlation-Id} or generated)
 * so governance rejections and job logs can be traced.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CorrelationIdFilter implements Filter {

    private static final int MAX_LENGTH = 128;

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest request = (HttpServletRequest) req;
        HttpServletResponse response = (HttpServletResponse) res;

        String corr = request.getHeader(RequestContextKeys.CORRELATION_ID_HEADER);
        if (corr == null || corr.isBlank() || corr.length() > MAX_LENGTH) corr = UUID.randomUUID().toString();

        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, corr);
        response.setHeader(RequestContextKeys.CORRELATION_ID_HEADER, corr);

        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(RequestContextKeys.CORRELATION_ID_MDC_KEY);
            MDC.remove(RequestContextKeys.SUBJECT_MDC_KEY);
        }
    }
}
