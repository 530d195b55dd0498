package com.jreinhal.querygate.intent;

public class MalformedIntentException extends RuntimeException {
    public MalformedIntentException(String message) {
        super(message);
    }

    public MalformedIntentException(String message, Throwable cause) {
        super(message, cause);
    }
}
