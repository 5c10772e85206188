package com.example.verifierfrontend.session;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Per-user store for the state that links the two phases of a presentation transaction.
 * Implementations must keep different users' sessions isolated; operations on one session
 * are last-write-wins.
 */
public interface TransactionSession {

    <T extends Serializable> Optional<T> get(SessionKey<T> key);

    <T extends Serializable> void set(SessionKey<T> key, T value);

    /**
     * Removes the slot and returns the value it held.
     */
    <T extends Serializable> Optional<T> delete(SessionKey<T> key);

    boolean has(SessionKey<?> key);

    /**
     * Slots currently holding a value, in schema order.
     */
    List<SessionKey<?>> keys();

    default SessionBatch getBatch(SessionKey<?>... keys) {
        SessionBatch.Builder batch = SessionBatch.builder();
        for (SessionKey<?> key : keys) {
            copy(key, batch);
        }
        return batch.build();
    }

    default void setBatch(SessionBatch batch) {
        batch.asMap().forEach((key, value) -> setUnchecked(key, value));
    }

    /**
     * Removes the given slots and returns the values that were present.
     */
    default SessionBatch deleteBatch(SessionKey<?>... keys) {
        SessionBatch removed = getBatch(keys);
        for (SessionKey<?> key : keys) {
            delete(key);
        }
        return removed;
    }

    default void clear() {
        deleteBatch(SessionKey.values().toArray(new SessionKey<?>[0]));
    }

    private <T extends Serializable> void copy(SessionKey<T> key, SessionBatch.Builder batch) {
        batch.putIfPresent(key, get(key));
    }

    private <T extends Serializable> void setUnchecked(SessionKey<T> key, Object value) {
        set(key, key.cast(value));
    }

}
