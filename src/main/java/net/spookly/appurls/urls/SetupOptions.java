package net.spookly.appurls.urls;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import net.spookly.appurls.app.BlueprintLoader;

/**
 * Options for {@link AppsUrlsBuilder#setup}.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SetupOptions {
    private final BlueprintLoader blueprintLoader;

    /**
     * Discover blueprint providers with {@link java.util.ServiceLoader}.
     */
    public static SetupOptions defaults() {
        return new SetupOptions(BlueprintLoader.serviceLoader());
    }

    public static SetupOptions withLoader(@NonNull BlueprintLoader blueprintLoader) {
        return new SetupOptions(blueprintLoader);
    }
}
