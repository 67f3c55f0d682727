package com.example.adaptivestream.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload of recoverable and fatal error notifications.
 */
public final class SessionError {

    private final ErrorKind kind;
    private final String message;
    private final Map<String, String> context;

    public SessionError(ErrorKind kind, String message, Map<String, String> context) {
        this.kind = kind;
        this.message = message;
        this.context = context == null
                ? Collections.<String, String>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static SessionError of(ErrorKind kind, String message, String... keyValues) {
        Map<String, String> context = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            context.put(keyValues[i], keyValues[i + 1]);
        }
        return new SessionError(kind, message, context);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, String> getContext() {
        return context;
    }

    @Override
    public String toString() {
        return kind + ": " + message + " " + context;
    }
}
