package com.netcracker.core.appstate.dispatch;

import com.netcracker.core.appstate.event.ChangeNotifier;
import com.netcracker.core.appstate.event.VariableChangeListener;
import com.netcracker.core.appstate.property.TypedProperty;
import com.netcracker.core.appstate.property.TypedPropertyRegistry;
import com.netcracker.core.appstate.property.UnsupportedCoercionException;
import com.netcracker.core.appstate.value.CoercionException;
import com.netcracker.core.appstate.value.Value;
import com.netcracker.core.appstate.variable.VariableStore;
import lombok.Getter;
import lombok.Setter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class StateDispatcherTest {

    private Schema schema;
    private VariableStore variables;
    private VariableChangeListener listener;
    private StateDispatcher<Schema> dispatcher;

    @BeforeEach
    void setUp() {
        schema = new Schema();
        listener = mock(VariableChangeListener.class);
        ChangeNotifier notifier = new ChangeNotifier();
        notifier.subscribe(listener);
        variables = new VariableStore(notifier);
        TypedPropertyRegistry<Schema> registry = new TypedPropertyRegistry<>(() -> List.of(
                TypedProperty.of("Title", String.class, Schema::getTitle, Schema::setTitle),
                TypedProperty.of("Enabled", Boolean.class, Schema::isEnabled, Schema::setEnabled),
                TypedProperty.of("Count", Integer.class, Schema::getCount, Schema::setCount),
                TypedProperty.of("Ratio", Double.class, Schema::getRatio, Schema::setRatio),
                TypedProperty.of("Price", BigDecimal.class, Schema::getPrice, Schema::setPrice),
                TypedProperty.of("Since", LocalDate.class, Schema::getSince, Schema::setSince)));
        dispatcher = new StateDispatcher<>(schema, registry, variables);
    }

    @Test
    void typedPropertyIsReadAsMatchingKind() {
        assertEquals(Value.of("untitled"), dispatcher.get("title"));
        assertEquals(Value.of(false), dispatcher.get("ENABLED"));
        assertEquals(Value.of(1L), dispatcher.get("Count"));
        assertEquals(Value.of(0.5), dispatcher.get("ratio"));
        assertEquals(Value.of(4.5), dispatcher.get("price"));
    }

    @Test
    void namesAreCaseInsensitive() {
        dispatcher.set("Score", Value.of(3L));

        assertEquals(Value.of(3L), dispatcher.get("SCORE"));
        assertEquals(Value.of(3L), dispatcher.get("score"));
        assertThat(variables.names()).containsExactly("score");
    }

    @Test
    void typedPropertyTakesPrecedenceOverVariables() {
        dispatcher.set("COUNT", Value.of(42L));
        dispatcher.set("count", Value.of("7"));

        assertEquals(7, schema.getCount());
        assertEquals(0, variables.size());
        assertTrue(dispatcher.isTypedProperty("Count"));
        verify(listener, never()).onVariableChanged(any());
    }

    @Test
    void typedPropertyCannotBeRemoved() {
        assertThatThrownBy(() -> dispatcher.set("title", null))
                .isInstanceOf(InvalidOperationException.class)
                .hasMessageContaining("Title");
        assertThatThrownBy(() -> dispatcher.remove("TITLE")).isInstanceOf(InvalidOperationException.class);
        assertEquals("untitled", schema.getTitle());
    }

    @Test
    void badCoercionLeavesPropertyUnchanged() {
        assertThatThrownBy(() -> dispatcher.set("count", Value.of("notanumber")))
                .isInstanceOf(CoercionException.class);

        assertEquals(1, schema.getCount());
        assertEquals(0, variables.size());
    }

    @Test
    void unsupportedPropertyTypeFails() {
        assertThatThrownBy(() -> dispatcher.set("since", Value.of("2024-01-01")))
                .isInstanceOf(UnsupportedCoercionException.class);
        assertThatThrownBy(() -> dispatcher.get("since")).isInstanceOf(UnsupportedCoercionException.class);
        assertEquals(LocalDate.of(2000, 1, 1), schema.getSince());
    }

    @Test
    void unknownNameFailsWithoutDefault() {
        assertThatThrownBy(() -> dispatcher.get("missing"))
                .isInstanceOf(VariableNotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void unknownNameReturnsDefault() {
        Value fallback = Value.of("fallback");

        assertSame(fallback, dispatcher.get("missing", fallback));
        assertNull(dispatcher.get("missing", null));
        assertThat(dispatcher.find("missing")).isEmpty();
        assertFalse(dispatcher.has("missing"));
    }

    @Test
    void defaultIsIgnoredForKnownNames() {
        dispatcher.set("known", Value.of(1L));

        assertEquals(Value.of(1L), dispatcher.get("known", Value.of(2L)));
        assertEquals(Value.of("untitled"), dispatcher.get("title", Value.of("other")));
    }

    @Test
    void everyEntryPointRejectsBlankNames() {
        assertThatThrownBy(() -> dispatcher.get(" ")).isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> dispatcher.get("", Value.of(1L))).isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> dispatcher.set(null, Value.of(1L))).isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> dispatcher.remove("\t")).isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> dispatcher.has("")).isInstanceOf(InvalidNameException.class);
    }

    @Test
    void removingUnknownVariableIsNoOp() {
        dispatcher.remove("ghost");

        verify(listener, never()).onVariableChanged(any());
    }

    @Test
    void typedKindsRoundTrip() {
        dispatcher.set("title", Value.of("Hello"));
        dispatcher.set("enabled", Value.of(true));
        dispatcher.set("count", Value.of(-17L));
        dispatcher.set("ratio", Value.of(0.125));
        dispatcher.set("price", Value.of(19.99));

        assertEquals("Hello", dispatcher.get("title").asString());
        assertTrue(dispatcher.get("enabled").asBoolean());
        assertEquals(-17L, dispatcher.get("count").asInteger());
        assertEquals(0.125, dispatcher.get("ratio").asFloat());
        assertEquals(19.99, dispatcher.get("price").asFloat());
    }

    @Test
    void crossKindWritesAreCoerced() {
        dispatcher.set("enabled", Value.of(1L));
        dispatcher.set("title", Value.of(2.5));
        dispatcher.set("ratio", Value.of("1e-3"));
        dispatcher.set("count", Value.of(true));

        assertTrue(schema.isEnabled());
        assertEquals("2.5", schema.getTitle());
        assertEquals(0.001, schema.getRatio());
        assertEquals(1, schema.getCount());
    }

    @Getter
    @Setter
    static class Schema {
        private String title = "untitled";
        private boolean enabled;
        private int count = 1;
        private double ratio = 0.5;
        private BigDecimal price = new BigDecimal("4.5");
        private LocalDate since = LocalDate.of(2000, 1, 1);
    }
}
