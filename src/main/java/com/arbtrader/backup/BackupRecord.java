package com.arbtrader.backup;

import com.arbtrader.domain.enums.BackupTier;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Value;

/** A backup written by the tiered backup manager and the storages that accepted it. */
@Value
public class BackupRecord {

    String key;
    BackupTier tier;
    LocalDateTime timestamp;
    List<String> storages;
}
