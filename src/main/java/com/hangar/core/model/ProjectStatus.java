package com.hangar.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a project.
 *
 * <pre>
 * creating -> running | error
 * running <-> stopped
 * running | stopped | error -> running   (restart)
 * any non-deleted -> deleted             (terminal)
 * </pre>
 */
public enum ProjectStatus {
    CREATING,
    RUNNING,
    STOPPED,
    ERROR,
    DELETED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == DELETED;
    }

    @JsonCreator
    public static ProjectStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        return ProjectStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
