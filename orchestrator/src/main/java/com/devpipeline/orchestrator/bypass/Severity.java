package com.devpipeline.orchestrator.bypass;

import java.util.Locale;

/** Declared most severe first; findings sort in this order. */
public enum Severity {
    CRITICAL, WARNING, INFO;

    /** Case-insensitive lookup used by the pattern catalog. */
    public static Severity parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("severity is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
