package com.eyelevel.docpipeline.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The document state accumulated across pipeline stages: an insertion-ordered mapping from string keys to
 * JSON-compatible values (strings, numbers, booleans, nulls, and nested maps/lists of those).
 * <p>
 * Stages receive a deep copy and hand back an updated payload. The orchestrator folds that result into the
 * execution's payload with {@link #mergedWith(StagePayload)}, which can overwrite values but never drops a key,
 * so keys written by earlier stages always survive.
 */
public final class StagePayload {

    private final Map<String, Object> values;

    public StagePayload() {
        this.values = new LinkedHashMap<>();
    }

    public StagePayload(final Map<String, ?> values) {
        this();
        values.forEach(this::put);
    }

    /**
     * Builds the initial payload of an execution from its trigger.
     */
    public static StagePayload seed(final DocumentRef document) {
        final StagePayload payload = new StagePayload();
        payload.put(PayloadKeys.BUCKET, document.container());
        payload.put(PayloadKeys.KEY, document.key());
        return payload;
    }

    /**
     * Stores a value under the given key. Values are copied on the way in, so later changes to the caller's
     * map or list do not leak into the payload.
     *
     * @throws IllegalArgumentException if the value (or anything nested in it) is not JSON-compatible.
     */
    @JsonAnySetter
    public StagePayload put(final String key, final Object value) {
        Objects.requireNonNull(key, "Payload key must not be null");
        values.put(key, copyValue(value));
        return this;
    }

    public Object get(final String key) {
        return values.get(key);
    }

    public String getString(final String key) {
        final Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    public boolean containsKey(final String key) {
        return values.containsKey(key);
    }

    public Set<String> keySet() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public int size() {
        return values.size();
    }

    /**
     * A read-only view of the payload, used for serialization.
     */
    @JsonAnyGetter
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public StagePayload deepCopy() {
        return new StagePayload(values);
    }

    /**
     * Returns a new payload holding every key of this payload plus every key of {@code contribution}; on a
     * key present in both, the contribution's value wins. Neither input is modified.
     */
    public StagePayload mergedWith(final StagePayload contribution) {
        final StagePayload merged = deepCopy();
        contribution.values.forEach(merged::put);
        return merged;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(final Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            final Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<Object, Object>) map).forEach((k, v) -> copy.put(String.valueOf(k), copyValue(v)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            final ArrayList<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        throw new IllegalArgumentException(
                "Unsupported payload value type: " + value.getClass().getName() + ". Only JSON-compatible values are allowed.");
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof StagePayload other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "StagePayload" + values.keySet();
    }
}
