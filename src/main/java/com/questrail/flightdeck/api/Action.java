package com.questrail.flightdeck.api;

import java.util.Map;
import java.util.Objects;

/**
 * Action
 * -----------------------------------------------------------------------------
 * An abstract automation action carried by a step, such as "log in" or
 * "create volume". The engine never interprets an action; only the
 * {@link Agent} that executes it does.
 *
 * <p>Actions may be supplied directly by a test definition, or produced by a
 * version-specific factory resolved from a requirement, so the same test can
 * run against different product versions without change.</p>
 */
public interface Action
{
    /**
     * Short action name, used in diagnostics and by agents to select behavior.
     */
    String name();

    /**
     * Free-form action parameters.
     */
    default Map<String, Object> parameters() {
        return Map.of();
    }

    /**
     * Creates a plain action with no parameters.
     */
    static Action of(String name) {
        return of(name, Map.of());
    }

    /**
     * Creates a plain action with the given parameters.
     */
    static Action of(String name, Map<String, Object> parameters) {
        return new Simple(name, parameters);
    }

    /** Value implementation used by {@link #of(String, Map)}. */
    record Simple(String name, Map<String, Object> parameters) implements Action {
        public Simple {
            Objects.requireNonNull(name, "name");
            parameters = Map.copyOf(Objects.requireNonNull(parameters, "parameters"));
        }
    }
}
