package net.spookly.appurls.urls;

import net.spookly.appurls.app.WebApplication;

/**
 * Creates the URL builder of an application while it is being assembled.
 */
@FunctionalInterface
public interface UrlsBuilderFactory {
    UrlsBuilder create(WebApplication app);
}
