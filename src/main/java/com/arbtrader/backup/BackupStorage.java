package com.arbtrader.backup;

import java.util.List;
import java.util.Optional;

/**
 * Key-value store for backup content (object or blob storage). Implementations report failures
 * through return values rather than exceptions.
 */
public interface BackupStorage {

    String getName();

    boolean save(String key, String content);

    Optional<String> read(String key);

    boolean delete(String key);

    boolean exists(String key);

    /** Keys starting with the prefix, in no particular order. */
    List<String> listKeys(String prefix);
}
