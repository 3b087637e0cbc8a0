package com.letterdesk.reviewcore.config;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
@Order(1)
public class RequestLoggingFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String method = httpRequest.getMethod();
        String uri = httpRequest.getRequestURI();
        String queryString = httpRequest.getQueryString();
        boolean bearer = httpRequest.getHeader("Authorization") != null;

        log.info("=== INCOMING REQUEST: {} {}{} (auth: {})", method, uri,
                queryString != null ? "?" + queryString : "", bearer ? "Bearer ***" : "none");

        long startTime = System.currentTimeMillis();
        try {
            chain.doFilter(request, response);
            log.info("REQUEST: Completed {} {} - Status: {} - Time: {}ms",
                    method, uri, httpResponse.getStatus(), System.currentTimeMillis() - startTime);
        } catch (Exception e) {
            log.error("REQUEST: Error processing {} {}: {}", method, uri, e.getMessage(), e);
            throw e;
        }
    }
}
