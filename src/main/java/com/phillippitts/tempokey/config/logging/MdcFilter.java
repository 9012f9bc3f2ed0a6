package com.phillippitts.tempokey.config.logging;

import com.phillippitts.tempokey.service.security.CallerContext;
import com.phillippitts.tempokey.service.security.CallerContextResolver;
import com.phillippitts.tempokey.service.security.Role;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Identifies the caller once per request and adds request-scoped values to Log4j2's MDC
 * (ThreadContext) for structured logging.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID; echoed back on the response</li>
 *   <li>userId: from X-User-ID header (if present)</li>
 *   <li>roles: granted roles, comma separated (only for privileged callers)</li>
 *   <li>method: HTTP method</li>
 *   <li>uri: request URI</li>
 * </ul>
 *
 * <p>The resolved {@link CallerContext} is stored under {@link #CALLER_ATTRIBUTE}, where controllers
 * pick it up for privileged operations. The context is always cleared after the request. Bulk
 * stream proxying runs on the bulk executor, which copies the context over.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String USER_ID_HEADER = "X-User-ID";
    public static final String CALLER_ATTRIBUTE = "com.phillippitts.tempokey.config.logging.MdcFilter.caller";

    private final CallerContextResolver callers;

    public MdcFilter(CallerContextResolver callers) {
        this.callers = Objects.requireNonNull(callers);
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = headerOrGenerate(http, REQUEST_ID_HEADER);
                ThreadContext.put("requestId", requestId);
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }

                CallerContext caller = callers.resolve(http.getHeader(USER_ID_HEADER));
                http.setAttribute(CALLER_ATTRIBUTE, caller);
                if (caller.userId() != null) {
                    ThreadContext.put("userId", caller.userId());
                }
                if (!caller.roles().isEmpty()) {
                    ThreadContext.put("roles", caller.roles().stream().map(Role::name).sorted()
                            .collect(Collectors.joining(",")));
                }

                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
