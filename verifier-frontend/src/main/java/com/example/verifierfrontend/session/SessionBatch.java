package com.example.verifierfrontend.session;

import org.springframework.util.Assert;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of slot values read from or written to a {@link TransactionSession} in one operation.
 * Iteration follows insertion order.
 */
public final class SessionBatch {

    private static final SessionBatch EMPTY = new SessionBatch(Map.of());

    private final Map<SessionKey<?>, Object> values;

    private SessionBatch(Map<SessionKey<?>, Object> values) {
        this.values = values;
    }

    public static SessionBatch empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public <T extends Serializable> Optional<T> get(SessionKey<T> key) {
        return Optional.ofNullable(values.get(key)).map(key::cast);
    }

    public Set<SessionKey<?>> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    Map<SessionKey<?>, Object> asMap() {
        return values;
    }

    public static final class Builder {

        private final Map<SessionKey<?>, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public <T extends Serializable> Builder put(SessionKey<T> key, T value) {
            Assert.notNull(key, "Session key must not be null");
            Assert.notNull(value, "Session value for '" + key + "' must not be null");
            values.put(key, value);
            return this;
        }

        /**
         * Adds the value when present, used when collecting slots that may be unset.
         */
        public <T extends Serializable> Builder putIfPresent(SessionKey<T> key, Optional<T> value) {
            value.ifPresent(v -> put(key, v));
            return this;
        }

        public SessionBatch build() {
            return values.isEmpty() ? EMPTY : new SessionBatch(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }

}
