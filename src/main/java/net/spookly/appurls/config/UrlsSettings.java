package net.spookly.appurls.config;

import java.util.List;

/**
 * The {@code urls} config section describing how URLs of the cooperating application are built.
 */
public class UrlsSettings {
    /**
     * Name of the config key holding this application's external base URL.
     */
    public String appPrefixKey;
    /**
     * Name of the config key holding the other application's external base URL.
     */
    public String otherAppPrefixKey;
    /**
     * Blueprint provider groups assembling this application.
     */
    public List<String> appGroups;
    /**
     * Blueprint provider groups whose routes are mirrored for the other application.
     */
    public List<String> otherAppGroups;
}
