package com.example.mailagent.integration;

import java.util.Locale;

/**
 * What an approval does with the drafted reply.
 */
public enum ReplyMode {
    /** send the draft as written, when the email needs a response */
    DRAFT,
    /** let the user rewrite the reply before it goes out */
    EDIT,
    /** file the email but send nothing */
    NONE;

    public String toWire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ReplyMode fromWire(String value) {
        if (value == null || value.isBlank()) {
            return DRAFT;
        }
        return ReplyMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
