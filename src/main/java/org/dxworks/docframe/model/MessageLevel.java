package org.dxworks.docframe.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity of a {@link SystemMessage}, ordered from {@link #DEBUG} to {@link #FATAL}.
 */
public enum MessageLevel {
    /** Debugging information without effect on the result. */
    DEBUG,
    /** A minor issue with little or no effect on the result. */
    INFO,
    /** An issue that may cause minor problems in the output. */
    WARNING,
    /** A major issue, the output will contain unpredictable errors. */
    ERROR,
    /** A critical issue, the output will contain severe errors. */
    FATAL;

    public boolean isAtLeast(MessageLevel other) {
        return compareTo(other) >= 0;
    }

    public static Optional<MessageLevel> fromName(String name) {
        if (name == null) return Optional.empty();
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
