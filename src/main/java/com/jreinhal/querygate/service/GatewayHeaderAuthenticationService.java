package com.jreinhal.querygate.service;

import com.jreinhal.querygate.model.User;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Trusts identity headers forwarded by an authenticating gateway, provided the request carries the shared
 * gateway token. Token verification of the end user happens at the gateway.
 */
@Service
@ConditionalOnProperty(name={"app.auth-mode"}, havingValue="GATEWAY")
public class GatewayHeaderAuthenticationService
implements AuthenticationService {
    private static final Logger log = LoggerFactory.getLogger(GatewayHeaderAuthenticationService.class);
    public static final String GATEWAY_TOKEN_HEADER = "X-Gateway-Token";
    private final byte[] sharedSecret;

    public GatewayHeaderAuthenticationService(@Value("${querygate.gateway.shared-secret:}") String sharedSecret) {
        this.sharedSecret = sharedSecret == null ? new byte[0] : sharedSecret.trim().getBytes(StandardCharsets.UTF_8);
        if (this.sharedSecret.length == 0) {
            log.error("GATEWAY auth mode without querygate.gateway.shared-secret; every request will be rejected");
        }
    }

    @Override
    public User authenticate(HttpServletRequest request) {
        if (this.sharedSecret.length == 0) {
            return null;
        }
        String token = request.getHeader(GATEWAY_TOKEN_HEADER);
        if (token == null || !MessageDigest.isEqual(this.sharedSecret, token.trim().getBytes(StandardCharsets.UTF_8))) {
            log.warn("Gateway token missing or invalid");
            return null;
        }
        String operatorId = CallerHeaders.trimToNull(request.getHeader(OPERATOR_HEADER));
        if (operatorId == null) {
            log.warn("Gateway request without {}", OPERATOR_HEADER);
            return null;
        }
        return CallerHeaders.toUser(request, operatorId);
    }

    @Override
    public String getAuthMode() {
        return "GATEWAY";
    }
}
