package com.jreinhal.querygate.intent;

public class IntentTranslationException extends RuntimeException {
    public IntentTranslationException(String message) {
        super(message);
    }

    public IntentTranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
