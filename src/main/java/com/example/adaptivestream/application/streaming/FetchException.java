package com.example.adaptivestream.application.streaming;

/**
 * A failed segment fetch, classified so the session knows whether switching providers can help.
 */
public class FetchException extends Exception {

    public enum Kind {
        TRANSIENT,
        FATAL
    }

    public static final int RANGE_NOT_SATISFIABLE = 416;

    private final Kind kind;
    private final int statusCode;

    public FetchException(Kind kind, String message, int statusCode) {
        this(kind, message, statusCode, null);
    }

    public FetchException(Kind kind, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static FetchException transientFailure(String message, Throwable cause) {
        return new FetchException(Kind.TRANSIENT, message, 0, cause);
    }

    /**
     * 408, 429 and 5xx can succeed elsewhere or later; every other non-2xx means the content
     * is not obtainable from this provider.
     */
    public static FetchException forStatus(int statusCode, String uri) {
        boolean retryable = statusCode == 408 || statusCode == 429 || statusCode >= 500;
        Kind kind = retryable ? Kind.TRANSIENT : Kind.FATAL;
        return new FetchException(kind, "HTTP " + statusCode + " from " + uri, statusCode);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRangeNotSatisfiable() {
        return statusCode == RANGE_NOT_SATISFIABLE;
    }
}
