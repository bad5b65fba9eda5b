package com.hangar.core.model;

/**
 * Feature toggles recorded for a project.
 */
public record EnabledFeatures(boolean auth, boolean storage, boolean realtime) {

    public static EnabledFeatures allEnabled() {
        return new EnabledFeatures(true, true, true);
    }
}
