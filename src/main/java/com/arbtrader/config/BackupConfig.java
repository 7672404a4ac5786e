package com.arbtrader.config;

import com.arbtrader.backup.BackupOptions;
import com.arbtrader.backup.BackupStorage;
import com.arbtrader.backup.InMemoryBackupStorage;
import com.arbtrader.backup.TierSettings;
import com.arbtrader.backup.TieredBackupManager;
import com.arbtrader.domain.enums.BackupTier;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the tiered backup manager from {@code arbtrader.backup.*}.
 *
 * <p>Storage backends are supplied as {@link BackupStorage} beans; the first one is primary.
 * Without any, an in-memory storage is used and grid state does not survive a restart.
 */
@Configuration
public class BackupConfig {

    private static final Logger log = LoggerFactory.getLogger(BackupConfig.class);

    @Bean
    @ConditionalOnMissingBean(BackupStorage.class)
    public BackupStorage inMemoryBackupStorage() {
        log.warn("No backup storage configured, grid state backups are kept in memory only");
        return new InMemoryBackupStorage("memory");
    }

    @Bean
    public BackupOptions backupOptions(ArbitrageProperties arbitrageProperties) {
        ArbitrageProperties.Backup backup = arbitrageProperties.getBackup();
        return new BackupOptions(
                new TierSettings(BackupTier.MINUTE, backup.getMinuteInterval(), backup.getMinuteMaxCount()),
                new TierSettings(BackupTier.HOUR, backup.getHourInterval(), backup.getHourMaxCount()),
                new TierSettings(BackupTier.DAILY, backup.getDailyInterval(), backup.getDailyMaxCount()));
    }

    @Bean
    public TieredBackupManager tieredBackupManager(
            ArbitrageProperties arbitrageProperties, BackupOptions backupOptions, List<BackupStorage> storages) {
        return new TieredBackupManager(arbitrageProperties.getOwnerName(), backupOptions, storages);
    }
}
