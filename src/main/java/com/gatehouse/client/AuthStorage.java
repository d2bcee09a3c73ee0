package com.gatehouse.client;

/**
 * Persistent key/value store backing the cached access token.
 */
public interface AuthStorage {

    String getItem(String key);

    void setItem(String key, String value);

    void removeItem(String key);
}
