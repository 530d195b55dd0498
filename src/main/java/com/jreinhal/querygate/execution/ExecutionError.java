package com.jreinhal.querygate.execution;

public enum ExecutionError {
    INVALID_RESOURCE,
    MISSING_TENANT,
    TIMEOUT,
    STORE_FAILURE,
    CANCELLED,
    OVERLOADED
}
