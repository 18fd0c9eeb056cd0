package dev.reviewgate.infrastructure.kantata;

/**
 * Any failed Kantata call: non-2xx response, timeout, transport error or a payload we cannot read.
 * {@code statusCode} is 0 when no HTTP response was received.
 */
public class KantataApiException extends RuntimeException {

    private final int statusCode;

    public KantataApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public KantataApiException(String message) {
        this(message, 0, null);
    }

    public static KantataApiException malformed(String what) {
        return new KantataApiException("Unexpected Kantata payload: " + what);
    }

    public int getStatusCode() {
        return statusCode;
    }
}
