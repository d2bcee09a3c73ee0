package com.gatehouse.client;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAuthStorage implements AuthStorage {

    private final Map<String, String> items = new ConcurrentHashMap<>();

    @Override
    public String getItem(String key) {
        return items.get(key);
    }

    @Override
    public void setItem(String key, String value) {
        items.put(key, value);
    }

    @Override
    public void removeItem(String key) {
        items.remove(key);
    }
}
