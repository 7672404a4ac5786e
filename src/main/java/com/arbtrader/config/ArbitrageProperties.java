package com.arbtrader.config;

import com.arbtrader.domain.enums.SpreadDirection;
import com.arbtrader.grid.GridLevelPair;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the arbitrage core, read from the {@code arbtrader} prefix.
 *
 * <p>Groups: signal generation, grid templates applied to newly added pairs by pair type,
 * order routing, tiered backups, reconciliation and the evaluation loop.
 */
@Configuration
@ConfigurationProperties(prefix = "arbtrader")
@Getter
@Setter
public class ArbitrageProperties {

    /** Owner name used in backup keys: trade_data/{ownerName}/backups/... */
    private String ownerName = "arbtrader";

    private Signal signal = new Signal();
    private Routing routing = new Routing();
    private Backup backup = new Backup();
    private Reconciliation reconciliation = new Reconciliation();
    private Engine engine = new Engine();

    /** Level pairs applied to a new pair whose type matches the key. */
    private Map<String, List<GridTemplateLevel>> gridTemplates = defaultGridTemplates();

    @Getter
    @Setter
    public static class Signal {

        /** How long an emitted signal stays active. */
        private Duration period = Duration.ofMinutes(5);

        /** Confidence stamped on every signal, within [0, 1]. Null leaves it unset. */
        private BigDecimal confidence;

        /** Skip pairs whose quotes are missing or inverted. */
        private boolean requireValidPrices = true;

        private String sourceModel = "ArbitrageSignalGenerator";
    }

    @Getter
    @Setter
    public static class Routing {

        /** MARKET, INSTRUMENT, SECURITY_TYPE or SIMPLE. */
        private String type = "SIMPLE";

        private String defaultAccount;

        /** Market name, instrument key or security type to account name, depending on the router type. */
        private Map<String, String> mappings = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Backup {

        private boolean enabled = true;

        private Duration minuteInterval = Duration.ofMinutes(5);
        private int minuteMaxCount = 50;

        private Duration hourInterval = Duration.ofHours(1);
        private int hourMaxCount = 24;

        private Duration dailyInterval = Duration.ofDays(1);
        private int dailyMaxCount = 7;
    }

    @Getter
    @Setter
    public static class Reconciliation {

        /** Overlap subtracted from the earliest last fill time when querying execution history. */
        private Duration overlap = Duration.ofMinutes(5);

        /** History window used when no fill has been seen yet. */
        private Duration defaultLookback = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Engine {

        private boolean autoStart = false;
    }

    /** One level pair of a grid template. */
    @Getter
    @Setter
    @NoArgsConstructor
    public static class GridTemplateLevel {

        private SpreadDirection direction;
        private BigDecimal entry;
        private BigDecimal exit;
        private BigDecimal size;

        public GridTemplateLevel(SpreadDirection direction, String entry, String exit, String size) {
            this.direction = direction;
            this.entry = new BigDecimal(entry);
            this.exit = new BigDecimal(exit);
            this.size = new BigDecimal(size);
        }

        public GridLevelPair toLevelPair() {
            return GridLevelPair.of(direction, entry, exit, size);
        }
    }

    private static Map<String, List<GridTemplateLevel>> defaultGridTemplates() {
        Map<String, List<GridTemplateLevel>> templates = new LinkedHashMap<>();
        templates.put(
                "crypto_stock",
                new ArrayList<>(List.of(
                        new GridTemplateLevel(SpreadDirection.LONG_SPREAD, "-0.02", "0.01", "0.5"),
                        new GridTemplateLevel(SpreadDirection.SHORT_SPREAD, "0.03", "-0.005", "0.5"))));
        templates.put(
                "spot_future",
                new ArrayList<>(List.of(
                        new GridTemplateLevel(SpreadDirection.LONG_SPREAD, "-0.015", "0.008", "0.3"),
                        new GridTemplateLevel(SpreadDirection.SHORT_SPREAD, "0.025", "-0.008", "0.3"))));
        return templates;
    }
}
