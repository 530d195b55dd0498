package com.jreinhal.querygate.service;

import com.jreinhal.querygate.model.User;
import com.jreinhal.querygate.model.UserContext;

public interface IdentityResolver {

    /**
     * Resolves the authenticated caller into tenant, role and scope values. Never returns null; a caller that
     * cannot be resolved gets the default role and no tenant, which refuses every read downstream.
     */
    UserContext resolve(User caller);
}
