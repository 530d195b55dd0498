package com.jreinhal.querygate.service;

import com.jreinhal.querygate.model.User;
import jakarta.servlet.http.HttpServletRequest;

public interface AuthenticationService {
    String OPERATOR_HEADER = "X-Operator-Id";
    String TENANT_HEADER = "X-Tenant-Id";
    String ROLE_HEADER = "X-Role";
    String SITES_HEADER = "X-Site-Ids";

    /**
     * @return the authenticated caller, or null when the request carries no acceptable credentials
     */
    User authenticate(HttpServletRequest request);

    String getAuthMode();
}
