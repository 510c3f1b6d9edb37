package com.netcracker.core.appstate;

import com.netcracker.core.appstate.event.ListenerFailurePolicy;
import io.smallrye.config.SmallRyeConfigBuilder;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.Config;

import java.util.Locale;

/**
 * Start-up settings of an {@link AppState}.
 * <p>
 * Read from MicroProfile Config keys under {@value #PREFIX}; missing keys keep the builder defaults.
 */
@Value
@Builder
@Slf4j
public class AppStateConfig {
    public static final String PREFIX = "appstate.";

    /**
     * Initial {@code AppName}.
     */
    @Builder.Default @NonNull String appName = "App";

    /**
     * Initial {@code AppVersion}.
     */
    @Builder.Default @NonNull String appVersion = "1.0.0";

    /**
     * Initial {@code DebugEnabled}.
     */
    @Builder.Default boolean debugEnabled = false;

    /**
     * Behaviour when a variable change listener throws.
     */
    @Builder.Default @NonNull ListenerFailurePolicy listenerFailurePolicy = ListenerFailurePolicy.LOG_AND_CONTINUE;

    /**
     * Subscribe a listener logging every variable change.
     */
    @Builder.Default boolean logVariableChanges = false;

    /**
     * Add the dynamic variables to the JSON snapshot.
     */
    @Builder.Default boolean snapshotIncludeVariables = false;

    public static AppStateConfig defaults() {
        return AppStateConfig.builder().build();
    }

    /**
     * Loads settings from system properties, environment variables and
     * {@code META-INF/microprofile-config.properties}.
     */
    public static AppStateConfig load() {
        return from(new SmallRyeConfigBuilder()
                .addDefaultSources()
                .addDiscoveredConverters()
                .build());
    }

    public static AppStateConfig from(Config config) {
        AppStateConfig defaults = defaults();
        AppStateConfig loaded = AppStateConfig.builder()
                .appName(config.getOptionalValue(PREFIX + "app-name", String.class).orElse(defaults.getAppName()))
                .appVersion(config.getOptionalValue(PREFIX + "app-version", String.class).orElse(defaults.getAppVersion()))
                .debugEnabled(config.getOptionalValue(PREFIX + "debug-enabled", Boolean.class).orElse(defaults.isDebugEnabled()))
                .listenerFailurePolicy(config.getOptionalValue(PREFIX + "listener-failure-policy", String.class)
                        .map(AppStateConfig::parsePolicy)
                        .orElse(defaults.getListenerFailurePolicy()))
                .logVariableChanges(config.getOptionalValue(PREFIX + "log-variable-changes", Boolean.class)
                        .orElse(defaults.isLogVariableChanges()))
                .snapshotIncludeVariables(config.getOptionalValue(PREFIX + "snapshot.include-variables", Boolean.class)
                        .orElse(defaults.isSnapshotIncludeVariables()))
                .build();
        log.info("Loaded app state config: {}", loaded);
        return loaded;
    }

    private static ListenerFailurePolicy parsePolicy(String value) {
        String name = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ListenerFailurePolicy.valueOf(name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown listener failure policy '" + value + "'", e);
        }
    }
}
