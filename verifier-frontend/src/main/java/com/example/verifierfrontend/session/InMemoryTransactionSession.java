package com.example.verifierfrontend.session;

import org.springframework.util.Assert;

import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed session for a single user, used outside a servlet container and in tests.
 */
public class InMemoryTransactionSession implements TransactionSession {

    private final Map<SessionKey<?>, Object> slots = new ConcurrentHashMap<>();

    @Override
    public <T extends Serializable> Optional<T> get(SessionKey<T> key) {
        return Optional.ofNullable(slots.get(key)).map(key::cast);
    }

    @Override
    public <T extends Serializable> void set(SessionKey<T> key, T value) {
        Assert.notNull(value, "Session value for '" + key + "' must not be null");
        slots.put(key, value);
    }

    @Override
    public <T extends Serializable> Optional<T> delete(SessionKey<T> key) {
        return Optional.ofNullable(slots.remove(key)).map(key::cast);
    }

    @Override
    public boolean has(SessionKey<?> key) {
        return slots.containsKey(key);
    }

    @Override
    public List<SessionKey<?>> keys() {
        return SessionKey.values().stream().filter(slots::containsKey).toList();
    }

    @Override
    public synchronized void setBatch(SessionBatch batch) {
        slots.putAll(batch.asMap());
    }

    @Override
    public synchronized SessionBatch deleteBatch(SessionKey<?>... keys) {
        return TransactionSession.super.deleteBatch(keys);
    }

}
