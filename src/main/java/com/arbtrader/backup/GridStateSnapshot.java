package com.arbtrader.backup;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON document written to backup storage: every grid position with its quantities, costs and
 * durable broker order ids. The tag identifies the pair legs and the level pair.
 *
 * <p>The per-market last fill times and the processed execution ids travel with the positions,
 * so history replay after a restart does not apply fills the quantities already contain.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GridStateSnapshot {

    public static final int CURRENT_VERSION = 1;

    private int version = CURRENT_VERSION;
    private LocalDateTime savedAt;
    private List<PositionState> positions = new ArrayList<>();
    private Map<String, LocalDateTime> lastFillTimes = new LinkedHashMap<>();
    private List<ExecutionState> processedExecutions = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PositionState {

        private String tag;
        private LocalDateTime openTime;
        private LocalDateTime firstFillTime;
        private BigDecimal leg1Quantity;
        private BigDecimal leg1AverageCost;
        private BigDecimal leg2Quantity;
        private BigDecimal leg2AverageCost;
        private Set<String> brokerOrderIds;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExecutionState {

        private String executionId;
        private String market;
        private LocalDateTime time;
    }
}
