package com.jreinhal.querygate.query;

/**
 * Reference to a stored entity (tenant, site) coming from trusted identity data, never from an intent.
 * The store adapter decides how to encode it.
 */
public record OpaqueId(String value) {
    @Override
    public String toString() {
        return this.value;
    }
}
