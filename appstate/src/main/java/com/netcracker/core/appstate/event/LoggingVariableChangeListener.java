package com.netcracker.core.appstate.event;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingVariableChangeListener implements VariableChangeListener {

    @Override
    public void onVariableChanged(VariableChangeEvent event) {
        switch (event.getType()) {
            case ADDED -> log.info("The {} variable added with value: '{}'.",
                    event.getVariableName(), event.getNewValue().asString());
            case UPDATED -> log.info("The {} variable value: '{}' updated to: '{}'.",
                    event.getVariableName(), event.getOldValue().asString(), event.getNewValue().asString());
            case REMOVED -> log.info("The {} variable removed. Its value was: '{}'.",
                    event.getVariableName(), event.getOldValue().asString());
        }
    }
}
