package com.arbtrader.backup;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Process-local backup storage. Used when no persistent storage bean is configured. */
public class InMemoryBackupStorage implements BackupStorage {

    private final String name;
    private final ConcurrentMap<String, String> entries = new ConcurrentHashMap<>();

    public InMemoryBackupStorage(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean save(String key, String content) {
        entries.put(key, content);
        return true;
    }

    @Override
    public Optional<String> read(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public boolean exists(String key) {
        return entries.containsKey(key);
    }

    @Override
    public List<String> listKeys(String prefix) {
        return entries.keySet().stream().filter(k -> k.startsWith(prefix)).toList();
    }
}
