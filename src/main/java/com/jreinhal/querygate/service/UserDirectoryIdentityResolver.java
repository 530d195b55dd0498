package com.jreinhal.querygate.service;

import com.jreinhal.querygate.model.User;
import com.jreinhal.querygate.model.UserContext;
import com.jreinhal.querygate.policy.RoleNames;
import com.jreinhal.querygate.repository.UserRepository;
import com.jreinhal.querygate.util.LogSanitizer;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Builds the caller's {@link UserContext} from the authenticated principal.
 *
 * <p>Every caller with an id is checked against the stored user record: a deactivated user resolves without a
 * tenant even when the gateway forwarded one, and a missing role, tenant or site list is completed from the
 * record. Callers the directory does not know keep their forwarded identity. When the directory cannot be
 * read the caller resolves without a tenant.</p>
 */
@Service
public class UserDirectoryIdentityResolver implements IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(UserDirectoryIdentityResolver.class);
    private final UserRepository userRepository;

    public UserDirectoryIdentityResolver(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public UserContext resolve(User caller) {
        if (caller == null) {
            return new UserContext(null, null, RoleNames.DEFAULT_ROLE, Set.of());
        }
        String role = caller.hasRole() ? caller.getRole() : null;
        String tenantId = caller.hasTenant() ? caller.getTenantId() : null;
        Set<String> sites = caller.getSiteIds() == null ? Set.of() : caller.getSiteIds();
        Optional<User> stored;
        try {
            stored = this.lookup(caller.getId());
        }
        catch (DataAccessException e) {
            log.warn("User directory lookup failed: {}", e.getClass().getSimpleName());
            return new UserContext(caller.getId(), null, role != null ? role : RoleNames.DEFAULT_ROLE, Set.of());
        }
        if (stored.isPresent()) {
            User user = stored.get();
            if (!user.isActive()) {
                log.warn("Caller {} is inactive; resolving without tenant", LogSanitizer.sanitize(caller.getId()));
                return new UserContext(caller.getId(), null, role != null ? role : RoleNames.DEFAULT_ROLE, Set.of());
            }
            role = role != null ? role : (user.hasRole() ? user.getRole() : null);
            tenantId = tenantId != null ? tenantId : (user.hasTenant() ? user.getTenantId() : null);
            if (sites.isEmpty() && user.getSiteIds() != null) {
                sites = user.getSiteIds();
            }
        }
        return new UserContext(caller.getId(), tenantId, role != null ? role : RoleNames.DEFAULT_ROLE, sites);
    }

    private Optional<User> lookup(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return this.userRepository.findById(id);
    }
}
