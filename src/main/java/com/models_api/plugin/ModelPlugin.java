package com.models_api.plugin;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Capability contract every pluggable model type implements.
 *
 * <p>Implementations are registered as Spring beans and collected by {@link ModelTypeRegistry}
 * at startup. A state object is owned by exactly one cache entry; {@link #train} must return a
 * new state instead of mutating the one it receives, so a failed or cancelled training leaves
 * the cached state untouched.</p>
 *
 * @param <S> in-memory state of a model instance
 */
public interface ModelPlugin<S> {

    /**
     * Unique tag of this model type, stored in every artifact it produces.
     */
    String getType();

    default String getDescription() {
        return "";
    }

    /**
     * Builds the untrained state written when a model instance is created.
     */
    S initialize(Map<String, Object> settings);

    /**
     * Trains on {@code data} starting from {@code state}.
     *
     * @throws IllegalArgumentException when the rows or options are malformed
     */
    S train(S state, List<Map<String, Object>> data, Map<String, Object> options);

    /**
     * Produces one output row per input row.
     *
     * @throws IllegalArgumentException when the rows or options are malformed
     * @throws IllegalStateException when the state cannot predict yet
     */
    List<Map<String, Object>> predict(S state, List<Map<String, Object>> data, Map<String, Object> options);

    byte[] serialize(S state) throws IOException;

    S deserialize(byte[] bytes) throws IOException;
}
