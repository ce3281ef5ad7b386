package io.mcpcompat.server.spi;

import java.util.Locale;
import java.util.Optional;

/**
 * Log severities a client can select with {@code logging/setLevel}, lowest first.
 */
public enum LogLevel {
    DEBUG, INFO, NOTICE, WARNING, ERROR, CRITICAL, ALERT, EMERGENCY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAtLeast(LogLevel other) {
        return compareTo(other) >= 0;
    }

    public static Optional<LogLevel> fromWireName(String name) {
        if (name == null) return Optional.empty();
        for (LogLevel level : values()) {
            if (level.wireName().equals(name)) return Optional.of(level);
        }
        return Optional.empty();
    }
}
