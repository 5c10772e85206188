package com.example.verifierfrontend.session;

import jakarta.servlet.http.HttpSession;
import org.springframework.util.Assert;
import org.springframework.web.util.WebUtils;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Transaction session stored as attributes of the servlet {@link HttpSession}.
 * Expiry follows the container's session timeout. Mutations hold the session mutex.
 */
public class HttpSessionTransactionSession implements TransactionSession {

    static final String ATTRIBUTE_PREFIX = "oid4vp.transaction.";

    private final HttpSession httpSession;

    public HttpSessionTransactionSession(HttpSession httpSession) {
        Assert.notNull(httpSession, "HttpSession must not be null");
        this.httpSession = httpSession;
    }

    @Override
    public <T extends Serializable> Optional<T> get(SessionKey<T> key) {
        return Optional.ofNullable(httpSession.getAttribute(attributeName(key))).map(key::cast);
    }

    @Override
    public <T extends Serializable> void set(SessionKey<T> key, T value) {
        Assert.notNull(value, "Session value for '" + key + "' must not be null");
        synchronized (WebUtils.getSessionMutex(httpSession)) {
            httpSession.setAttribute(attributeName(key), value);
        }
    }

    @Override
    public <T extends Serializable> Optional<T> delete(SessionKey<T> key) {
        synchronized (WebUtils.getSessionMutex(httpSession)) {
            Optional<T> previous = get(key);
            httpSession.removeAttribute(attributeName(key));
            return previous;
        }
    }

    @Override
    public boolean has(SessionKey<?> key) {
        return httpSession.getAttribute(attributeName(key)) != null;
    }

    @Override
    public List<SessionKey<?>> keys() {
        return SessionKey.values().stream().filter(this::has).toList();
    }

    @Override
    public void setBatch(SessionBatch batch) {
        synchronized (WebUtils.getSessionMutex(httpSession)) {
            TransactionSession.super.setBatch(batch);
        }
    }

    @Override
    public SessionBatch deleteBatch(SessionKey<?>... keys) {
        synchronized (WebUtils.getSessionMutex(httpSession)) {
            return TransactionSession.super.deleteBatch(keys);
        }
    }

    private static String attributeName(SessionKey<?> key) {
        return ATTRIBUTE_PREFIX + key.name();
    }

}
