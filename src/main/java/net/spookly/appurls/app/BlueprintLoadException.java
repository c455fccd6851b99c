package net.spookly.appurls.app;

/**
 * Blueprint discovery or registration failed while assembling an application.
 */
public class BlueprintLoadException extends RuntimeException {
    public BlueprintLoadException(String message) {
        super(message);
    }

    public BlueprintLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
