package com.jreinhal.querygate;

import jakarta.annotation.PostConstruct;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Environment;

@SpringBootApplication
public class QueryGateApplication {
    private static final Logger log = LoggerFactory.getLogger(QueryGateApplication.class);
    private final Environment environment;

    public QueryGateApplication(Environment environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        SpringApplication.run(QueryGateApplication.class, args);
    }

    @PostConstruct
    public void validateSecurityConfiguration() {
        String authMode = this.environment.getProperty("app.auth-mode", "DEV");
        boolean isDevProfile = Arrays.stream(this.environment.getActiveProfiles()).anyMatch(profile -> "dev".equalsIgnoreCase(profile));
        if ("DEV".equalsIgnoreCase(authMode) && !isDevProfile) {
            log.error("=================================================================");
            log.error("  CRITICAL SECURITY ERROR: DEV AUTH MODE OUTSIDE DEV PROFILE");
            log.error("=================================================================");
            log.error("  DEV mode takes tenant, role and sites from request headers.");
            log.error("  Set app.auth-mode=GATEWAY for non-dev deployments.");
            log.error("  To override (NOT RECOMMENDED): set ALLOW_DEV_AUTH=true");
            if (!"true".equalsIgnoreCase(this.environment.getProperty("ALLOW_DEV_AUTH", "false"))) {
                throw new SecurityException("DEV auth mode is not allowed outside the dev profile.");
            }
            log.warn("!!! DEV AUTH OVERRIDE ACTIVE !!!");
        }
        if ("DEV".equalsIgnoreCase(authMode)) {
            log.warn("DEV auth mode active: identity is read from X-Operator-Id / X-Tenant-Id / X-Role / X-Site-Ids headers");
        } else {
            log.info("Security configuration validated: auth mode {}", authMode);
        }
    }
}
