package com.netcracker.core.appstate.dispatch;

import java.util.Locale;

/**
 * Name checks shared by every entry point. Names are case-insensitive: the lowercase form
 * is the lookup key of typed properties and variables alike.
 */
public final class VariableNames {

    private VariableNames() {
    }

    /**
     * @throws InvalidNameException if the name is null, empty or whitespace only
     */
    public static void check(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidNameException("A variable name expected");
        }
    }

    /**
     * Lowercases a valid name. No trimming and no locale specific folding; idempotent.
     *
     * @throws InvalidNameException if the name is null, empty or whitespace only
     */
    public static String normalize(String name) {
        check(name);
        return name.toLowerCase(Locale.ROOT);
    }
}
