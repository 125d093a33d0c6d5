package com.pulsegrid.matrix.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every matrix request with a trace id that is echoed back, kept in the MDC and carried
 * into error bodies. Caller-supplied ids are accepted only when they are short and printable.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Pulsegrid-Trace";
    public static final String MDC_TRACE_ID = "trace_id";
    public static final String MDC_ROUTE = "route";

    private static final Pattern ACCEPTED_TRACE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(TRACE_HEADER));
        String route = request.getMethod() + " " + request.getRequestURI();
        RequestContextHolder.set(new RequestContextHolder.RequestContext(traceId, route));
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_ROUTE, route);
        response.setHeader(TRACE_HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_ROUTE);
            RequestContextHolder.clear();
        }
    }

    static String resolveTraceId(String supplied) {
        if (supplied != null && ACCEPTED_TRACE_ID.matcher(supplied).matches()) {
            return supplied;
        }
        return UUID.randomUUID().toString();
    }
}
