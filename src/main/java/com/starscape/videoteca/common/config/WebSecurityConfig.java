package com.starscape.videoteca.common.config;

import com.starscape.videoteca.common.security.JwtAuthenticationFilter;
import com.starscape.videoteca.common.security.JwtTokenProvider;
import com.starscape.videoteca.common.web.EnvelopeWriter;
import com.starscape.videoteca.common.web.RateLimitFilter;
import com.starscape.videoteca.common.web.RateLimiter;
import com.starscape.videoteca.common.web.RequestLoggingFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.XXssProtectionHeaderWriter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.time.Clock;
import java.util.List;

/**
 * Request pipeline, in order: CORS, request logging, rate limiting, bearer-token authentication.
 * Security response headers are added to every response.
 */
@Configuration
@EnableWebSecurity
public class WebSecurityConfig {
    
    static final String UPLOAD_PATH = "/api/v1/videos/upload";
    
    @Bean
    public SecurityFilterChain filterChain(
            HttpSecurity http,
            JwtTokenProvider tokenProvider,
            RateLimiter rateLimiter,
            EnvelopeWriter envelopeWriter) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .cors(cors -> {})
                .exceptionHandling(handler -> handler
                        .authenticationEntryPoint((request, response, ex) ->
                                envelopeWriter.write(response, HttpStatus.UNAUTHORIZED, "Authentication required"))
                        .accessDeniedHandler((request, response, ex) ->
                                envelopeWriter.write(response, HttpStatus.FORBIDDEN, "Access denied")))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers("/error").permitAll()
                        .requestMatchers("/api/v1/videos/**", "/api/v1/videos").authenticated()
                        .anyRequest().authenticated())
                .headers(headers -> headers
                        .frameOptions(HeadersConfigurer.FrameOptionsConfig::deny)
                        .contentTypeOptions(options -> {})
                        .xssProtection(xss -> xss.headerValue(XXssProtectionHeaderWriter.HeaderValue.ENABLED_MODE_BLOCK))
                        .httpStrictTransportSecurity(hsts -> hsts
                                .includeSubDomains(true)
                                .maxAgeInSeconds(31536000)))
                .addFilterAfter(new RequestLoggingFilter(), CorsFilter.class)
                .addFilterAfter(new RateLimitFilter(rateLimiter, envelopeWriter), RequestLoggingFilter.class)
                .addFilterBefore(new JwtAuthenticationFilter(tokenProvider), UsernamePasswordAuthenticationFilter.class);
        
        return http.build();
    }
    
    @Bean
    public RateLimiter rateLimiter(RateLimitProperties properties) {
        List<RateLimitProperties.Rule> rules = properties.isEnabled() ? properties.getRules() : List.of();
        return new RateLimiter(rules, Clock.systemUTC());
    }
    
    @Bean
    public CorsConfigurationSource corsConfigurationSource(CorsProperties properties) {
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        
        // Registered first so that it wins over the catch-all below
        CorsConfiguration upload = new CorsConfiguration();
        upload.setAllowedOrigins(properties.getUploadAllowedOrigins());
        upload.setAllowedMethods(List.of("POST", "OPTIONS"));
        upload.setAllowedHeaders(List.of(
                "Content-Type", "Authorization", "Accept", "X-Requested-With", "Origin"));
        upload.setAllowCredentials(true);
        upload.setMaxAge(properties.getMaxAge());
        source.registerCorsConfiguration(UPLOAD_PATH, upload);
        
        CorsConfiguration api = new CorsConfiguration();
        api.setAllowedOrigins(properties.getAllowedOrigins());
        api.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS"));
        api.setAllowedHeaders(List.of(
                "Content-Type", "Authorization", "Accept", "X-Requested-With",
                "Origin", "Cache-Control", "Content-Length"));
        api.setExposedHeaders(List.of("set-cookie"));
        api.setAllowCredentials(true);
        source.registerCorsConfiguration("/**", api);
        
        return source;
    }
}
