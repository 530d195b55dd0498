package com.jreinhal.querygate.filter;

import com.jreinhal.querygate.model.User;
import com.jreinhal.querygate.policy.RoleNames;
import com.jreinhal.querygate.service.AuthenticationService;
import com.jreinhal.querygate.util.LogSanitizer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates {@code /api/**} requests through the configured {@link AuthenticationService}. The caller is
 * available from {@link SecurityContext} and the Spring Security context until the request completes.
 */
@Component
@Order(value=2)
public class SecurityFilter
extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(SecurityFilter.class);
    static final String API_PREFIX = "/api/";
    public static final String MDC_CALLER_KEY = "caller";
    private static final String[] PUBLIC_API_PATHS = new String[]{
            "/api/health"
    };
    private final AuthenticationService authService;

    public SecurityFilter(AuthenticationService authService) {
        this.authService = authService;
        log.info("Security filter initialized with auth mode: {}", authService.getAuthMode());
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith(API_PREFIX) || this.isPublicApiPath(path);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest httpRequest, HttpServletResponse httpResponse, FilterChain chain) throws IOException, ServletException {
        User user = this.authService.authenticate(httpRequest);
        if (user == null) {
            log.warn("Authentication failed for path: {} from IP: {}", LogSanitizer.sanitize(httpRequest.getRequestURI()), LogSanitizer.sanitize(httpRequest.getRemoteAddr()));
            httpResponse.setStatus(401);
            httpResponse.setContentType("application/json");
            httpResponse.getWriter().write("{\"error\":\"Authentication required\"}");
            return;
        }
        SecurityContext.setCurrentUser(user);
        this.setSpringSecurityContext(user);
        MDC.put(MDC_CALLER_KEY, LogSanitizer.sanitize(user.getId()));
        try {
            chain.doFilter(httpRequest, httpResponse);
        }
        finally {
            SecurityContext.clear();
            SecurityContextHolder.clearContext();
            MDC.remove(MDC_CALLER_KEY);
        }
    }

    private boolean isPublicApiPath(String path) {
        for (String apiPath : PUBLIC_API_PATHS) {
            if (apiPath.equals(path)) {
                return true;
            }
        }
        return false;
    }

    private void setSpringSecurityContext(User user) {
        String role = user.hasRole() ? RoleNames.normalize(user.getRole()) : RoleNames.DEFAULT_ROLE;
        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(user, null,
                List.of(new SimpleGrantedAuthority("ROLE_" + role.toUpperCase(Locale.ROOT))));
        SecurityContextHolder.getContext().setAuthentication(auth);
    }
}
