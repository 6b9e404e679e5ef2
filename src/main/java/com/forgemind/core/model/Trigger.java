package com.forgemind.core.model;

import java.io.Serializable;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Activation hint for a behavior. Triggers are informational metadata and never evolve.
 *
 * @param kind     what the pattern is matched against
 * @param pattern  glob, command prefix, event name or query fragment depending on {@code kind}
 * @param priority higher wins when several behaviors match the same probe
 */
public record Trigger(
    TriggerKind kind,
    String pattern,
    int priority
) implements Serializable {

    /**
     * Matches a probe of the same kind: glob for file patterns, prefix for commands,
     * exact name for events and case-insensitive substring for queries.
     */
    public boolean matches(TriggerKind probeKind, String probe) {
        if (probeKind != kind || probe == null || pattern == null) {
            return false;
        }
        return switch (kind) {
            case FILE_PATTERN -> FileSystems.getDefault()
                    .getPathMatcher("glob:" + pattern)
                    .matches(Path.of(probe));
            case COMMAND -> probe.startsWith(pattern);
            case EVENT -> probe.equals(pattern);
            case QUERY -> probe.toLowerCase(Locale.ROOT).contains(pattern.toLowerCase(Locale.ROOT));
        };
    }
}
