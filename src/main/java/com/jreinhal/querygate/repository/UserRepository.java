package com.jreinhal.querygate.repository;

import com.jreinhal.querygate.model.User;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Stored callers. Only id lookups are used, to complete identities the authentication layer left partial.
 */
@Repository
public interface UserRepository extends MongoRepository<User, String> {
}
