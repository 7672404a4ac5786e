package com.arbtrader.backup;

import com.arbtrader.domain.enums.BackupTier;
import com.arbtrader.exception.ValidationException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes backups into minute, hour and daily tiers with per-tier retention.
 *
 * <p>Keys follow {@code trade_data/{ownerName}/backups/{tier}/{yyyyMMdd_HHmmss}}.
 *
 * <p>Save protocol:
 * <ol>
 *   <li>rate limit: nothing is written until the minute-tier interval has passed since the last backup</li>
 *   <li>pick the coarsest tier whose interval has elapsed; a coarser backup also resets the finer tiers</li>
 *   <li>write to every storage; the backup counts if at least one storage accepts it</li>
 *   <li>delete the oldest backups of that tier beyond its max count, in every storage</li>
 * </ol>
 *
 * <p>The first storage is primary: last backup times are recovered from it after a restart and
 * restores read from it first.
 */
public class TieredBackupManager {

    private static final Logger log = LoggerFactory.getLogger(TieredBackupManager.class);

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final String ownerName;
    private final BackupOptions options;
    private final List<BackupStorage> storages;

    private final Map<BackupTier, LocalDateTime> lastBackupTimes = new EnumMap<>(BackupTier.class);
    private boolean initialized;

    public TieredBackupManager(String ownerName, BackupOptions options, List<BackupStorage> storages) {
        if (ownerName == null || ownerName.isBlank() || ownerName.contains("/")) {
            throw new ValidationException("ownerName", "Backup owner name must be non-blank and contain no '/'");
        }
        if (storages == null || storages.isEmpty()) {
            throw new ValidationException("storages", "At least one backup storage is required");
        }
        this.ownerName = ownerName;
        this.options = options;
        this.storages = List.copyOf(storages);
    }

    /**
     * Saves the content if the rate limit allows it.
     *
     * @return the written backup, or empty when rate limited or no storage accepted it
     */
    public synchronized Optional<BackupRecord> saveBackup(String content, LocalDateTime now) {
        initializeIfNeeded();
        LocalDateTime lastBackup = lastBackupTimes.get(BackupTier.MINUTE);
        if (lastBackup != null && now.isBefore(lastBackup.plus(options.getMinute().getInterval()))) {
            log.debug("Backup skipped, last backup at {}", lastBackup);
            return Optional.empty();
        }

        BackupTier tier = selectTier(now);
        String key = keyFor(tier, now);
        List<String> accepted = new ArrayList<>();
        for (BackupStorage storage : storages) {
            try {
                if (storage.save(key, content)) {
                    accepted.add(storage.getName());
                } else {
                    log.warn("Backup storage {} rejected {}", storage.getName(), key);
                }
            } catch (RuntimeException e) {
                log.error("Backup storage {} failed saving {}", storage.getName(), key, e);
            }
        }
        if (accepted.isEmpty()) {
            log.error("Backup {} was not saved to any storage", key);
            return Optional.empty();
        }

        for (BackupTier t : BackupTier.values()) {
            if (t.ordinal() <= tier.ordinal()) {
                lastBackupTimes.put(t, now);
            }
        }
        cleanup(tier);
        log.info("Saved {} backup {} to {}", tier.getPathSegment(), key, accepted);
        return Optional.of(new BackupRecord(key, tier, now, accepted));
    }

    /** Content of the most recent readable backup across all tiers, primary storage first. */
    public synchronized Optional<String> restoreLatest() {
        for (BackupStorage storage : storages) {
            for (String key : keysNewestFirst(storage)) {
                try {
                    Optional<String> content = storage.read(key);
                    if (content.isPresent()) {
                        log.info("Restoring backup {} from {}", key, storage.getName());
                        return content;
                    }
                } catch (RuntimeException e) {
                    log.error("Backup storage {} failed reading {}", storage.getName(), key, e);
                }
            }
        }
        log.info("No backup found for {}", ownerName);
        return Optional.empty();
    }

    /** Keys of one tier in the primary storage, oldest first. */
    public synchronized List<String> listBackups(BackupTier tier) {
        return sortedKeys(storages.get(0), tier);
    }

    public synchronized BackupStatistics getStatistics() {
        initializeIfNeeded();
        Map<BackupTier, Integer> counts = new EnumMap<>(BackupTier.class);
        for (BackupTier tier : BackupTier.values()) {
            counts.put(tier, sortedKeys(storages.get(0), tier).size());
        }
        LocalDateTime latest = lastBackupTimes.values().stream()
                .max(Comparator.naturalOrder())
                .orElse(null);
        return BackupStatistics.builder()
                .backupCounts(counts)
                .lastBackupTimes(Map.copyOf(lastBackupTimes))
                .latestBackupTime(latest)
                .storages(storages.stream().map(BackupStorage::getName).toList())
                .build();
    }

    public String keyFor(BackupTier tier, LocalDateTime timestamp) {
        return tierPrefix(tier) + TIMESTAMP_FORMAT.format(timestamp);
    }

    public String tierPrefix(BackupTier tier) {
        return "trade_data/" + ownerName + "/backups/" + tier.getPathSegment() + "/";
    }

    private BackupTier selectTier(LocalDateTime now) {
        for (TierSettings settings : options.coarsestFirst()) {
            LocalDateTime last = lastBackupTimes.get(settings.getTier());
            if (last == null || !now.isBefore(last.plus(settings.getInterval()))) {
                return settings.getTier();
            }
        }
        return BackupTier.MINUTE;
    }

    private void cleanup(BackupTier tier) {
        int maxCount = options.get(tier).getMaxCount();
        for (BackupStorage storage : storages) {
            try {
                List<String> keys = sortedKeys(storage, tier);
                for (int i = 0; i < keys.size() - maxCount; i++) {
                    if (storage.delete(keys.get(i))) {
                        log.debug("Deleted expired backup {} from {}", keys.get(i), storage.getName());
                    }
                }
            } catch (RuntimeException e) {
                log.error("Backup cleanup failed for {} tier in {}", tier.getPathSegment(), storage.getName(), e);
            }
        }
    }

    private void initializeIfNeeded() {
        if (initialized) {
            return;
        }
        initialized = true;
        BackupStorage primary = storages.get(0);
        try {
            for (BackupTier tier : BackupTier.values()) {
                List<String> keys = sortedKeys(primary, tier);
                if (!keys.isEmpty()) {
                    lastBackupTimes.put(tier, parseTimestamp(keys.get(keys.size() - 1)));
                }
            }
        } catch (RuntimeException e) {
            log.error("Could not read existing backups from {}", primary.getName(), e);
        }
        // a coarser backup also counts for the finer tiers
        BackupTier[] tiers = BackupTier.values();
        for (int i = tiers.length - 2; i >= 0; i--) {
            LocalDateTime coarser = lastBackupTimes.get(tiers[i + 1]);
            LocalDateTime finer = lastBackupTimes.get(tiers[i]);
            if (coarser != null && (finer == null || coarser.isAfter(finer))) {
                lastBackupTimes.put(tiers[i], coarser);
            }
        }
    }

    /** Keys of a tier with a parseable timestamp, oldest first. */
    private List<String> sortedKeys(BackupStorage storage, BackupTier tier) {
        return storage.listKeys(tierPrefix(tier)).stream()
                .filter(k -> parseTimestamp(k) != null)
                .sorted()
                .toList();
    }

    private List<String> keysNewestFirst(BackupStorage storage) {
        List<String> keys = new ArrayList<>();
        try {
            for (BackupTier tier : BackupTier.values()) {
                keys.addAll(sortedKeys(storage, tier));
            }
        } catch (RuntimeException e) {
            log.error("Could not list backups in {}", storage.getName(), e);
        }
        keys.sort(Comparator.comparing((String key) -> parseTimestamp(key)).reversed());
        return keys;
    }

    static LocalDateTime parseTimestamp(String key) {
        String name = key.substring(key.lastIndexOf('/') + 1);
        try {
            return LocalDateTime.parse(name, TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring backup key with unparseable timestamp: {}", key);
            return null;
        }
    }
}
