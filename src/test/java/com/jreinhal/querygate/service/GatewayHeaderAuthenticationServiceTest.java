package com.jreinhal.querygate.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.querygate.model.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class GatewayHeaderAuthenticationServiceTest {

    private final GatewayHeaderAuthenticationService service = new GatewayHeaderAuthenticationService("s3cret");

    private static MockHttpServletRequest request(String token, String operator) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/ask");
        request.setRemoteAddr("10.0.0.8");
        if (token != null) {
            request.addHeader(GatewayHeaderAuthenticationService.GATEWAY_TOKEN_HEADER, token);
        }
        if (operator != null) {
            request.addHeader(AuthenticationService.OPERATOR_HEADER, operator);
        }
        request.addHeader(AuthenticationService.TENANT_HEADER, "t-1");
        request.addHeader(AuthenticationService.ROLE_HEADER, "superadmin");
        return request;
    }

    @Test
    @DisplayName("Valid gateway token admits the forwarded identity")
    void acceptsValidToken() {
        User user = service.authenticate(request("s3cret", "op-1"));

        assertThat(user).isNotNull();
        assertThat(user.getId()).isEqualTo("op-1");
        assertThat(user.getTenantId()).isEqualTo("t-1");
        assertThat(user.getRole()).isEqualTo("superadmin");
    }

    @Test
    @DisplayName("Wrong or missing token is rejected")
    void rejectsBadToken() {
        assertThat(service.authenticate(request("guess", "op-1"))).isNull();
        assertThat(service.authenticate(request(null, "op-1"))).isNull();
    }

    @Test
    @DisplayName("Operator id is mandatory")
    void requiresOperator() {
        assertThat(service.authenticate(request("s3cret", null))).isNull();
    }

    @Test
    @DisplayName("Without a configured secret nothing is accepted")
    void emptySecretRejectsAll() {
        GatewayHeaderAuthenticationService unconfigured = new GatewayHeaderAuthenticationService("");

        assertThat(unconfigured.authenticate(request("", "op-1"))).isNull();
        assertThat(unconfigured.getAuthMode()).isEqualTo("GATEWAY");
    }
}
