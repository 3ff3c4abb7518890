package com.example.trafficgate;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * ハンドラの手前に置くアドミッションゲート。
 *
 *  - クライアントキーが取れない → 500（レジストリには触らない、後ろにも流さない）
 *  - バケットが枯れている       → 429 + Retry-After
 *  - それ以外                   → 後続のハンドラへ
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class AdmissionFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AdmissionFilter.class);

    private final RateLimiterService rateLimiterService;
    private final RateLimitProperties props;
    private final ObjectMapper objectMapper;

    public AdmissionFilter(RateLimiterService rateLimiterService, RateLimitProperties props, ObjectMapper objectMapper) {
        this.rateLimiterService = rateLimiterService;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path != null && path.startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String clientKey = resolveClientKey(request);
        if (clientKey == null) {
            log.error("Could not resolve client address for {} {}", request.getMethod(), request.getRequestURI());
            writeError(response, HttpStatus.INTERNAL_SERVER_ERROR,
                    new ErrorResponse("client_unresolvable", "Internal Server Error"));
            return;
        }

        AllowResult res = rateLimiterService.allow(clientKey);
        if (!res.allowed()) {
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(res.retryAfterSeconds()));
            writeError(response, HttpStatus.TOO_MANY_REQUESTS,
                    new ErrorResponse("rate_limit_exceeded", "Too Many Requests"));
            return;
        }

        response.setHeader("X-RateLimit-Remaining", String.valueOf(res.remaining()));
        filterChain.doFilter(request, response);
    }

    /**
     * @return クライアントキー。決められないときは null
     */
    String resolveClientKey(HttpServletRequest request) {
        if (props.isTrustForwardedFor()) {
            String forwarded = request.getHeader("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                String first = forwarded.split(",", -1)[0].trim();
                if (!first.isEmpty()) {
                    return first;
                }
            }
        }
        String addr = request.getRemoteAddr();
        if (addr == null || addr.isBlank()) {
            return null;
        }
        return addr.trim();
    }

    private void writeError(HttpServletResponse response, HttpStatus status, ErrorResponse payload) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), payload);
    }
}
