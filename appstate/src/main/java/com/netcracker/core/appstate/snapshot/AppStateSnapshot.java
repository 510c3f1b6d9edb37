package com.netcracker.core.appstate.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.netcracker.core.appstate.property.TypedProperty;
import com.netcracker.core.appstate.property.TypedPropertyRegistry;
import com.netcracker.core.appstate.value.Value;
import com.netcracker.core.appstate.variable.VariableStore;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One-way JSON export of the typed properties.
 * <p>
 * The document is a flat object keyed by declared property names, in declaration order. Every value
 * is the JSON string of the property's textual form, numbers and booleans included. When variables
 * are included they appear as a nested object under {@value #VARIABLES_KEY}.
 *
 * @param <S> schema type holding the typed properties
 */
@Slf4j
public class AppStateSnapshot<S> {
    public static final String VARIABLES_KEY = "Variables";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new SimpleModule("app-state-values").addSerializer(Value.class, new ValueJsonSerializer()));

    private final S state;
    private final TypedPropertyRegistry<S> registry;
    private final VariableStore variables;
    private final boolean includeVariables;

    public AppStateSnapshot(S state, TypedPropertyRegistry<S> registry, VariableStore variables, boolean includeVariables) {
        this.state = Objects.requireNonNull(state, "state");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.variables = Objects.requireNonNull(variables, "variables");
        this.includeVariables = includeVariables;
    }

    /**
     * @return pretty-printed JSON document of the current typed property values
     */
    public String toJson() {
        Map<String, Object> document = new LinkedHashMap<>();
        for (TypedProperty<S, ?> property : registry.properties()) {
            document.put(property.name(), property.read(state));
        }
        if (includeVariables) {
            document.put(VARIABLES_KEY, variables.asMap());
        }
        try {
            String json = OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(document);
            log.debug("Serialized app state snapshot with {} entries", document.size());
            return json;
        } catch (JsonProcessingException e) {
            throw new SnapshotSerializationException("Failed to serialize app state to JSON", e);
        }
    }

    /**
     * Snapshots cannot be read back.
     *
     * @throws NotSupportedException always
     */
    public S fromJson(String json) {
        throw new NotSupportedException("App state snapshots are export only");
    }
}
