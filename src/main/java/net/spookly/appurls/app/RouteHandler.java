package net.spookly.appurls.app;

/**
 * Request handler bound to an endpoint of a live application.
 */
@FunctionalInterface
public interface RouteHandler {
    String handle(RequestContext context);
}
