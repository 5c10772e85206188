package com.example.verifierfrontend.session;

import com.example.verifierfrontend.model.EphemeralEcdhPrivateJwk;
import com.example.verifierfrontend.model.Nonce;
import com.example.verifierfrontend.model.PresentationId;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Typed slot of the transaction session. The set of slots is fixed; {@link #values()} lists it in write order.
 *
 * @param <T> type stored under the slot
 */
public final class SessionKey<T extends Serializable> {

    public static final SessionKey<PresentationId> PRESENTATION_ID =
            new SessionKey<>("presentationId", PresentationId.class);
    public static final SessionKey<Nonce> NONCE =
            new SessionKey<>("nonce", Nonce.class);
    public static final SessionKey<EphemeralEcdhPrivateJwk> EPHEMERAL_ECDH_PRIVATE_JWK =
            new SessionKey<>("ephemeralECDHPrivateJwk", EphemeralEcdhPrivateJwk.class);

    private static final List<SessionKey<?>> VALUES = List.of(PRESENTATION_ID, NONCE, EPHEMERAL_ECDH_PRIVATE_JWK);

    private final String name;
    private final Class<T> type;

    private SessionKey(String name, Class<T> type) {
        this.name = name;
        this.type = type;
    }

    public static List<SessionKey<?>> values() {
        return VALUES;
    }

    public static Optional<SessionKey<?>> fromName(String name) {
        return VALUES.stream().filter(key -> key.name.equals(name)).findFirst();
    }

    public String name() {
        return name;
    }

    public Class<T> type() {
        return type;
    }

    public T cast(Object value) {
        return type.cast(value);
    }

    @Override
    public String toString() {
        return name;
    }

}
