package uk.gegc.aimeter.shared.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Assigns every request an id, echoes it in the response and exposes it to logs via MDC.
 * A caller-supplied {@code X-Request-Id} is kept only when {@link CorrelationIds#isAcceptable} allows it.
 */
@Slf4j
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String supplied = request.getHeader(CorrelationIds.HEADER_REQUEST_ID);
        String requestId = CorrelationIds.acceptOrGenerate(supplied);
        if (supplied != null && !requestId.equals(supplied)) {
            log.debug("Rejected malformed {} header, assigned {}", CorrelationIds.HEADER_REQUEST_ID, requestId);
        }
        request.setAttribute(CorrelationIds.ATTR_REQUEST_ID, requestId);
        response.setHeader(CorrelationIds.HEADER_REQUEST_ID, requestId);
        MDC.put(CorrelationIds.ATTR_REQUEST_ID, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(CorrelationIds.ATTR_REQUEST_ID);
        }
    }
}
