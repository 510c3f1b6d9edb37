package com.netcracker.core.appstate.script;

import com.netcracker.core.appstate.AppState;
import com.netcracker.core.appstate.value.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Words giving scripts access to an {@link AppState}.
 * <p>
 * Stack effects, top of stack rightmost:
 * <ul>
 *   <li>{@code GET ( name -- value )}</li>
 *   <li>{@code SET ( value name -- )}</li>
 *   <li>{@code REMOVE-VARIABLE ( name -- )}</li>
 *   <li>{@code GET-APP-STATE-JSON ( -- json )}</li>
 *   <li>{@code DEBUG ( value -- )}, logged only while {@code DebugEnabled} is set</li>
 * </ul>
 * The host registers {@link #words()} with its interpreter; names are taken from the textual form
 * of the popped value.
 */
@Slf4j
public class AppStateWords {
    public static final String GET = "GET";
    public static final String SET = "SET";
    public static final String REMOVE_VARIABLE = "REMOVE-VARIABLE";
    public static final String GET_APP_STATE_JSON = "GET-APP-STATE-JSON";
    public static final String DEBUG = "DEBUG";

    private final AppState appState;

    public AppStateWords(AppState appState) {
        this.appState = Objects.requireNonNull(appState, "appState");
    }

    public Map<String, PrimitiveWord> words() {
        Map<String, PrimitiveWord> words = new LinkedHashMap<>();
        words.put(GET, this::get);
        words.put(SET, this::set);
        words.put(REMOVE_VARIABLE, this::removeVariable);
        words.put(GET_APP_STATE_JSON, this::getAppStateJson);
        words.put(DEBUG, this::debug);
        return Collections.unmodifiableMap(words);
    }

    void get(ScriptStack stack) {
        stack.expect(1);
        String name = stack.pop().asString();
        stack.push(appState.get(name));
    }

    void set(ScriptStack stack) {
        stack.expect(2);
        String name = stack.pop().asString();
        Value value = stack.pop();
        appState.set(name, value);
    }

    void removeVariable(ScriptStack stack) {
        stack.expect(1);
        appState.remove(stack.pop().asString());
    }

    void getAppStateJson(ScriptStack stack) {
        stack.push(Value.of(appState.toJson()));
    }

    void debug(ScriptStack stack) {
        stack.expect(1);
        String message = stack.pop().asString();
        if (appState.properties().isDebugEnabled()) {
            log.info("Debug: {}", message);
        }
    }
}
