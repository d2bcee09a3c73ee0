package com.gatehouse.client;

import java.net.CookieStore;
import java.net.HttpCookie;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client-side cache of the access token and the principal it resolves to.
 *
 * <p>The token lives on up to three surfaces: memory, an optional {@link AuthStorage} and an
 * optional {@link CookieStore}. {@link #setToken(String)} is the only writer of all three and
 * {@link #setPrincipal(AccountPrincipal)} the only writer of the principal, so surfaces and
 * listeners never drift apart.
 */
public class AuthState {

    private static final Logger log = LoggerFactory.getLogger(AuthState.class);

    private static final AuthState GLOBAL = new AuthState();

    private final AccountFetcher accountFetcher;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<PrincipalChangeListener> listeners = new CopyOnWriteArraySet<>();

    private volatile AuthStateConfig config;
    private volatile String token;
    private volatile AccountPrincipal principal;
    private volatile boolean initialized;

    public AuthState() {
        this(new HttpAccountFetcher());
    }

    public AuthState(AccountFetcher accountFetcher) {
        this.accountFetcher = Objects.requireNonNull(accountFetcher, "accountFetcher");
    }

    /**
     * Process-wide instance.
     */
    public static AuthState global() {
        return GLOBAL;
    }

    /**
     * Applies {@code config} and tries to restore a session from whatever token is available.
     * Calling it again re-applies the configuration and restores again.
     *
     * @return the restored principal, empty when there is no token or it no longer resolves
     */
    public Optional<AccountPrincipal> initialize(AuthStateConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.initialized = true;

        Optional<String> current = getToken();
        if (current.isEmpty()) {
            clear();
            return Optional.empty();
        }

        Optional<AccountPrincipal> account;
        try {
            account = accountFetcher.fetch(config, current.get());
        } catch (RuntimeException ex) {
            log.warn("Session restoration failed", ex);
            account = Optional.empty();
        }
        if (account.isEmpty()) {
            clear();
            return Optional.empty();
        }
        setPrincipal(account.get());
        return account;
    }

    /**
     * Token from memory, else the cookie, else storage. A token found outside memory is written
     * back to every surface.
     */
    public Optional<String> getToken() {
        String inMemory = token;
        if (inMemory != null) {
            return Optional.of(inMemory);
        }
        lock.lock();
        try {
            // a concurrent clear() either ran before this read or waits for the write-back
            if (token != null) {
                return Optional.of(token);
            }
            String found = readCookie();
            if (found == null) {
                found = readStorage();
            }
            if (found != null) {
                setToken(found);
            }
            return Optional.ofNullable(found);
        } finally {
            lock.unlock();
        }
    }

    public void setToken(String value) {
        String normalized = value == null || value.isBlank() ? null : value;
        lock.lock();
        try {
            this.token = normalized;
            writeStorage(normalized);
            writeCookie(normalized);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Listeners are notified only when the principal's identity changes.
     */
    public void setPrincipal(AccountPrincipal value) {
        boolean changed;
        lock.lock();
        try {
            AccountPrincipal previous = this.principal;
            changed = previous == null ? value != null : value == null || !Objects.equals(previous.id(), value.id());
            this.principal = value;
        } finally {
            lock.unlock();
        }
        if (changed) {
            notifyListeners(value);
        }
    }

    public Optional<AccountPrincipal> getPrincipal() {
        return Optional.ofNullable(principal);
    }

    public boolean hasRole(String role) {
        AccountPrincipal current = principal;
        return current != null && current.hasRole(role);
    }

    /**
     * @return a handle removing the listener
     */
    public Runnable onPrincipalChange(PrincipalChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return () -> listeners.remove(listener);
    }

    public void offPrincipalChange(PrincipalChangeListener listener) {
        listeners.remove(listener);
    }

    public void clear() {
        setToken(null);
        setPrincipal(null);
    }

    public boolean isInitialized() {
        return initialized;
    }

    public String getBaseUrl() {
        return requireConfig().getBaseUrl();
    }

    public AuthStateConfig getConfig() {
        return requireConfig();
    }

    private AuthStateConfig requireConfig() {
        AuthStateConfig current = config;
        if (current == null) {
            throw new IllegalStateException("AuthState not initialized. Call initialize() first.");
        }
        return current;
    }

    private void notifyListeners(AccountPrincipal value) {
        for (PrincipalChangeListener listener : listeners) {
            try {
                listener.onPrincipalChange(value);
            } catch (RuntimeException ex) {
                log.warn("Principal change listener failed", ex);
            }
        }
    }

    private String readStorage() {
        AuthStateConfig current = config;
        if (current == null || current.getStorage() == null) {
            return null;
        }
        String value = current.getStorage().getItem(current.getCookieName());
        return value == null || value.isBlank() ? null : value;
    }

    private void writeStorage(String value) {
        AuthStateConfig current = config;
        if (current == null || current.getStorage() == null) {
            return;
        }
        if (value != null) {
            current.getStorage().setItem(current.getCookieName(), value);
        } else {
            current.getStorage().removeItem(current.getCookieName());
        }
    }

    private String readCookie() {
        AuthStateConfig current = config;
        if (current == null || current.getCookieStore() == null) {
            return null;
        }
        URI uri = URI.create(current.getBaseUrl());
        for (HttpCookie cookie : current.getCookieStore().get(uri)) {
            if (cookie.getName().equals(current.getCookieName())
                    && cookie.getValue() != null
                    && !cookie.getValue().isBlank()) {
                return cookie.getValue();
            }
        }
        return null;
    }

    private void writeCookie(String value) {
        AuthStateConfig current = config;
        if (current == null || current.getCookieStore() == null) {
            return;
        }
        CookieStore store = current.getCookieStore();
        URI uri = URI.create(current.getBaseUrl());
        for (HttpCookie cookie : store.get(uri)) {
            if (cookie.getName().equals(current.getCookieName())) {
                store.remove(uri, cookie);
            }
        }
        if (value != null) {
            HttpCookie cookie = new HttpCookie(current.getCookieName(), value);
            cookie.setPath("/");
            cookie.setVersion(0);
            store.add(uri, cookie);
        }
    }
}
