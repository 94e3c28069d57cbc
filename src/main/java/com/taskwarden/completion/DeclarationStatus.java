package com.taskwarden.completion;

import java.util.Locale;

/**
 * Status argument of the agent's {@code complete_task} call.
 */
public enum DeclarationStatus {
    SUCCESS,
    PARTIAL,
    BLOCKED,
    UNKNOWN;

    /**
     * Lenient parse; anything unrecognised (including null) is {@link #UNKNOWN}.
     */
    public static DeclarationStatus from(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "success" -> SUCCESS;
            case "partial" -> PARTIAL;
            case "blocked" -> BLOCKED;
            default -> UNKNOWN;
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
