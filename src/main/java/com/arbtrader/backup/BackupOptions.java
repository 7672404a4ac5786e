package com.arbtrader.backup;

import com.arbtrader.domain.enums.BackupTier;
import com.arbtrader.exception.ValidationException;
import java.time.Duration;
import java.util.List;
import lombok.Value;

/**
 * Tier configuration of the tiered backup manager. Defaults: a backup at most every 5 minutes
 * keeping 50, hourly keeping 24, daily keeping 7.
 */
@Value
public class BackupOptions {

    TierSettings minute;
    TierSettings hour;
    TierSettings daily;

    public BackupOptions(TierSettings minute, TierSettings hour, TierSettings daily) {
        if (minute == null || hour == null || daily == null) {
            throw new ValidationException("tiers", "All three backup tiers are required");
        }
        if (hour.getInterval().compareTo(minute.getInterval()) < 0
                || daily.getInterval().compareTo(hour.getInterval()) < 0) {
            throw new ValidationException("tiers", "Backup tier intervals must not decrease from minute to daily");
        }
        this.minute = minute;
        this.hour = hour;
        this.daily = daily;
    }

    public static BackupOptions defaults() {
        return new BackupOptions(
                new TierSettings(BackupTier.MINUTE, Duration.ofMinutes(5), 50),
                new TierSettings(BackupTier.HOUR, Duration.ofHours(1), 24),
                new TierSettings(BackupTier.DAILY, Duration.ofDays(1), 7));
    }

    public TierSettings get(BackupTier tier) {
        return switch (tier) {
            case MINUTE -> minute;
            case HOUR -> hour;
            case DAILY -> daily;
        };
    }

    /** Coarsest first. */
    public List<TierSettings> coarsestFirst() {
        return List.of(daily, hour, minute);
    }
}
