package com.arbtrader.backup;

import com.arbtrader.domain.enums.BackupTier;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BackupStatistics {

    /** Backups retained per tier in the primary storage. */
    Map<BackupTier, Integer> backupCounts;

    Map<BackupTier, LocalDateTime> lastBackupTimes;
    LocalDateTime latestBackupTime;
    List<String> storages;

    public int getTotalBackups() {
        return backupCounts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
