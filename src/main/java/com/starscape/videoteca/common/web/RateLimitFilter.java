package com.starscape.videoteca.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

public class RateLimitFilter extends OncePerRequestFilter {
    
    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);
    
    private final RateLimiter rateLimiter;
    private final EnvelopeWriter envelopeWriter;
    
    public RateLimitFilter(RateLimiter rateLimiter, EnvelopeWriter envelopeWriter) {
        this.rateLimiter = rateLimiter;
        this.envelopeWriter = envelopeWriter;
    }
    
    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return "OPTIONS".equalsIgnoreCase(request.getMethod());
    }
    
    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        Optional<Duration> retryAfter = rateLimiter.tryAcquire(request.getRemoteAddr(), path);
        
        if (retryAfter.isPresent()) {
            log.warn("Rate limit exceeded for {} on {}", request.getRemoteAddr(), path);
            response.setHeader(HttpHeaders.RETRY_AFTER,
                String.valueOf(Math.max(1, retryAfter.get().toSeconds())));
            envelopeWriter.write(response, HttpStatus.TOO_MANY_REQUESTS, "Too many requests, please try again later");
            return;
        }
        filterChain.doFilter(request, response);
    }
}
