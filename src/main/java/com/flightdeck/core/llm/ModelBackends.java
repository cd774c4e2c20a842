package com.flightdeck.core.llm;

import com.flightdeck.core.routing.ExecutionTarget;

import java.util.EnumMap;
import java.util.Map;

/**
 * The cloud and local backends, looked up by target.
 */
public class ModelBackends {

    private final Map<ExecutionTarget, ModelBackend> backends = new EnumMap<>(ExecutionTarget.class);

    public ModelBackends(ModelBackend cloud, ModelBackend local) {
        backends.put(ExecutionTarget.CLOUD, cloud);
        backends.put(ExecutionTarget.LOCAL, local);
    }

    public boolean isAvailable(ExecutionTarget target) {
        ModelBackend backend = backends.get(target);
        return backend != null && backend.isAvailable();
    }

    /**
     * @throws IllegalArgumentException for {@link ExecutionTarget#AUTO}, which must be resolved by the router first
     */
    public ModelBackend get(ExecutionTarget target) {
        if (target == ExecutionTarget.AUTO) {
            throw new IllegalArgumentException("AUTO must be resolved to a concrete target");
        }
        return backends.get(target);
    }
}
