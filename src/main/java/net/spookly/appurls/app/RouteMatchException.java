package net.spookly.appurls.app;

/**
 * Dispatch found no handler for a request: 404 when no rule matches, 405 when only the method is wrong.
 */
public class RouteMatchException extends RuntimeException {
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;

    private final int status;

    public RouteMatchException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
