package com.arbtrader.backup;

import com.arbtrader.domain.enums.BackupTier;
import com.arbtrader.exception.ValidationException;
import java.time.Duration;
import lombok.Value;

/** Minimum spacing between backups of a tier and how many of them are retained. */
@Value
public class TierSettings {

    BackupTier tier;
    Duration interval;
    int maxCount;

    public TierSettings(BackupTier tier, Duration interval, int maxCount) {
        if (tier == null) {
            throw new ValidationException("tier", "Backup tier is required");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new ValidationException(tier.getPathSegment() + ".interval", "Backup tier interval must be positive");
        }
        if (maxCount <= 0) {
            throw new ValidationException(
                    tier.getPathSegment() + ".maxCount",
                    "Backup tier max count must be positive");
        }
        this.tier = tier;
        this.interval = interval;
        this.maxCount = maxCount;
    }
}
