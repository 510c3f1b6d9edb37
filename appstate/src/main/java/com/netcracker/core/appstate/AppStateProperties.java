package com.netcracker.core.appstate;

import com.netcracker.core.appstate.property.TypedProperty;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

/**
 * Typed properties of the application state.
 * <p>
 * {@link #declarations()} is the explicit property table: each entry binds a declared name to the
 * field accessors. Adding a property means adding a field and a table entry.
 */
@Getter
@Setter
@ToString
public class AppStateProperties {
    private String appName = "App";
    private String appVersion = "1.0.0";
    private boolean debugEnabled;
    private int intValue = 1;
    private float floatValue = 2.1f;
    private double doubleValue = 3.4;
    private BigDecimal decimalValue = new BigDecimal("4.5");

    public static List<TypedProperty<AppStateProperties, ?>> declarations() {
        return List.of(
                TypedProperty.of("AppName", String.class, AppStateProperties::getAppName, AppStateProperties::setAppName),
                TypedProperty.of("AppVersion", String.class, AppStateProperties::getAppVersion, AppStateProperties::setAppVersion),
                TypedProperty.of("DebugEnabled", Boolean.class, AppStateProperties::isDebugEnabled, AppStateProperties::setDebugEnabled),
                TypedProperty.of("IntValue", Integer.class, AppStateProperties::getIntValue, AppStateProperties::setIntValue),
                TypedProperty.of("FloatValue", Float.class, AppStateProperties::getFloatValue, AppStateProperties::setFloatValue),
                TypedProperty.of("DoubleValue", Double.class, AppStateProperties::getDoubleValue, AppStateProperties::setDoubleValue),
                TypedProperty.of("DecimalValue", BigDecimal.class, AppStateProperties::getDecimalValue, AppStateProperties::setDecimalValue)
        );
    }
}
