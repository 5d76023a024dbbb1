package com.bank.lending.api.filter;

import com.bank.lending.application.service.CorrelationIdService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Correlates a request with its log lines, audit records and live-update events.
 *
 * A caller-supplied {@code X-Correlation-ID} is kept only when it is a short token of letters, digits,
 * dots, underscores and dashes; anything else is replaced by a generated id. The id is echoed on the response.
 */
@Component
@Order(1)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdFilter.class);

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final Pattern ACCEPTED_ID = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

    private final CorrelationIdService correlationIdService;

    public CorrelationIdFilter(CorrelationIdService correlationIdService) {
        this.correlationIdService = correlationIdService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        try {
            String supplied = request.getHeader(CORRELATION_ID_HEADER);
            String correlationId;
            if (supplied != null && ACCEPTED_ID.matcher(supplied).matches()) {
                correlationId = supplied;
                correlationIdService.setCorrelationId(correlationId);
            } else {
                correlationId = correlationIdService.generateCorrelationId();
                if (supplied != null) {
                    log.debug("Replaced malformed correlation id on {} {}", request.getMethod(), request.getRequestURI());
                }
            }

            response.setHeader(CORRELATION_ID_HEADER, correlationId);

            filterChain.doFilter(request, response);
        } finally {
            correlationIdService.clear();
        }
    }
}
