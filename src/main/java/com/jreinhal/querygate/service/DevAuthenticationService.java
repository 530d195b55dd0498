package com.jreinhal.querygate.service;

import com.jreinhal.querygate.model.User;
import com.jreinhal.querygate.util.LogSanitizer;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name={"app.auth-mode"}, havingValue="DEV", matchIfMissing=true)
public class DevAuthenticationService
implements AuthenticationService {
    private static final Logger log = LoggerFactory.getLogger(DevAuthenticationService.class);
    static final String DEMO_OPERATOR = "DEMO_USER";
    private final boolean allowRemote;

    public DevAuthenticationService(@Value("${app.dev.allow-remote:false}") boolean allowRemote) {
        this.allowRemote = allowRemote;
        log.warn(">>> DEVELOPMENT AUTH MODE ACTIVE - IDENTITY IS TAKEN FROM REQUEST HEADERS <<<");
        log.warn(">>> Set app.auth-mode=GATEWAY behind an authenticating gateway for production <<<");
    }

    @Override
    public User authenticate(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        if (!this.allowRemote && remoteAddr != null && !isLoopback(remoteAddr)) {
            log.error("DEV auth blocked for remote address: {}", LogSanitizer.sanitize(remoteAddr));
            return null;
        }
        String operatorId = CallerHeaders.trimToNull(request.getHeader(OPERATOR_HEADER));
        return CallerHeaders.toUser(request, operatorId != null ? operatorId : DEMO_OPERATOR);
    }

    @Override
    public String getAuthMode() {
        return "DEV";
    }

    private static boolean isLoopback(String remoteAddr) {
        return remoteAddr.equals("127.0.0.1") || remoteAddr.equals("::1") || remoteAddr.equals("0:0:0:0:0:0:0:1");
    }
}
