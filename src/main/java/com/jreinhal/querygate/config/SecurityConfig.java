package com.jreinhal.querygate.config;

import com.jreinhal.querygate.filter.CorrelationIdFilter;
import com.jreinhal.querygate.filter.SecurityFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.context.SecurityContextHolderFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;

@Configuration
public class SecurityConfig {
    private final SecurityFilter securityFilter;
    private final CorrelationIdFilter correlationIdFilter;

    public SecurityConfig(SecurityFilter securityFilter, CorrelationIdFilter correlationIdFilter) {
        this.securityFilter = securityFilter;
        this.correlationIdFilter = correlationIdFilter;
    }

    // Both filters run inside the security chain only.
    @Bean
    public FilterRegistrationBean<SecurityFilter> securityFilterRegistration(SecurityFilter filter) {
        FilterRegistrationBean<SecurityFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<CorrelationIdFilter> correlationIdFilterRegistration(CorrelationIdFilter filter) {
        FilterRegistrationBean<CorrelationIdFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    @Profile(value={"dev"})
    public SecurityFilterChain devSecurityFilterChain(HttpSecurity http) throws Exception {
        this.commonFilters(http)
                .authorizeHttpRequests(auth -> auth.anyRequest().permitAll());
        return http.build();
    }

    @Bean
    @Profile(value={"!dev"})
    public SecurityFilterChain defaultSecurityFilterChain(HttpSecurity http) throws Exception {
        this.commonFilters(http)
                .exceptionHandling(ex -> ex.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
                .authorizeHttpRequests(auth -> {
                    auth.requestMatchers("/api/health").permitAll();
                    auth.requestMatchers("/swagger-ui.html", "/swagger-ui/**", "/v3/api-docs/**").authenticated();
                    auth.requestMatchers("/api/**").authenticated();
                    auth.anyRequest().denyAll();
                });
        return http.build();
    }

    private HttpSecurity commonFilters(HttpSecurity http) throws Exception {
        return http.addFilterBefore(this.correlationIdFilter, SecurityContextHolderFilter.class)
                .addFilterBefore(this.securityFilter, AnonymousAuthenticationFilter.class)
                // Credentials travel in headers only; there is no session cookie to forge requests with.
                .csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .headers(headers -> headers.frameOptions(HeadersConfigurer.FrameOptionsConfig::deny)
                        .contentTypeOptions(contentType -> {})
                        .referrerPolicy(referrer -> referrer.policy(ReferrerPolicyHeaderWriter.ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN)));
    }
}
