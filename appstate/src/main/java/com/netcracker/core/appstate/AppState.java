package com.netcracker.core.appstate;

import com.netcracker.core.appstate.dispatch.StateDispatcher;
import com.netcracker.core.appstate.event.ChangeNotifier;
import com.netcracker.core.appstate.event.ListenerRegistration;
import com.netcracker.core.appstate.event.LoggingVariableChangeListener;
import com.netcracker.core.appstate.event.VariableChangeListener;
import com.netcracker.core.appstate.event.VariableChangeType;
import com.netcracker.core.appstate.property.TypedPropertyRegistry;
import com.netcracker.core.appstate.snapshot.AppStateSnapshot;
import com.netcracker.core.appstate.value.Value;
import com.netcracker.core.appstate.variable.VariableStore;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Application state shared by the host and its scripts.
 * <p>
 * Combines the typed properties of {@link AppStateProperties} with dynamic variables behind one
 * case-insensitive {@code get}/{@code set} protocol. Typed property names are reserved: setting one
 * writes the property, never a variable. Only variable changes are published to listeners.
 * <p>
 * Built explicitly by the host and passed where needed. Meant for one control thread; concurrent
 * callers must serialize access themselves.
 *
 * <pre>{@code
 * AppState appState = new AppState(AppStateConfig.load());
 * appState.subscribe(event -> log.info("{}", event));
 * appState.set("score", Value.of(10));
 * long score = appState.get("SCORE").asInteger();
 * }</pre>
 */
@Slf4j
public class AppState {

    private final AppStateProperties properties;
    private final TypedPropertyRegistry<AppStateProperties> registry;
    private final ChangeNotifier notifier;
    private final VariableStore variables;
    private final StateDispatcher<AppStateProperties> dispatcher;
    private final AppStateSnapshot<AppStateProperties> snapshot;

    public AppState() {
        this(AppStateConfig.defaults());
    }

    public AppState(AppStateConfig config) {
        Objects.requireNonNull(config, "config");
        this.properties = new AppStateProperties();
        this.properties.setAppName(config.getAppName());
        this.properties.setAppVersion(config.getAppVersion());
        this.properties.setDebugEnabled(config.isDebugEnabled());

        this.registry = new TypedPropertyRegistry<>(AppStateProperties::declarations);
        this.notifier = new ChangeNotifier(config.getListenerFailurePolicy());
        this.variables = new VariableStore(notifier);
        this.dispatcher = new StateDispatcher<>(properties, registry, variables);
        this.snapshot = new AppStateSnapshot<>(properties, registry, variables, config.isSnapshotIncludeVariables());

        if (config.isLogVariableChanges()) {
            notifier.subscribe(new LoggingVariableChangeListener());
        }
        log.debug("Created app state '{}' version '{}'", properties.getAppName(), properties.getAppVersion());
    }

    public Value get(String name) {
        return dispatcher.get(name);
    }

    @Nullable
    public Value get(String name, @Nullable Value defaultValue) {
        return dispatcher.get(name, defaultValue);
    }

    public Optional<Value> find(String name) {
        return dispatcher.find(name);
    }

    public boolean has(String name) {
        return dispatcher.has(name);
    }

    public boolean isTypedProperty(String name) {
        return dispatcher.isTypedProperty(name);
    }

    public void set(String name, @Nullable Value value) {
        dispatcher.set(name, value);
    }

    public void remove(String name) {
        dispatcher.remove(name);
    }

    /**
     * Removes every dynamic variable. Typed properties keep their values.
     */
    public void clearVariables() {
        variables.clear();
    }

    public ListenerRegistration subscribe(VariableChangeListener listener) {
        return notifier.subscribe(listener);
    }

    public ListenerRegistration subscribe(VariableChangeType type, VariableChangeListener listener) {
        return notifier.subscribe(type, listener);
    }

    /**
     * @return copy of the dynamic variables in insertion order
     */
    public Map<String, Value> variables() {
        return variables.asMap();
    }

    /**
     * Direct typed access for host code; script-facing access goes through {@link #get} and {@link #set}.
     */
    public AppStateProperties properties() {
        return properties;
    }

    public String toJson() {
        return snapshot.toJson();
    }

    public AppStateSnapshot<AppStateProperties> snapshot() {
        return snapshot;
    }
}
