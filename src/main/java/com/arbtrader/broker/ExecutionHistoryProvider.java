package com.arbtrader.broker;

import com.arbtrader.domain.model.ExecutionRecord;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Optional capability of a brokerage connection: querying past executions.
 * Detected once when the connection is registered.
 */
public interface ExecutionHistoryProvider {

    List<ExecutionRecord> getExecutionHistory(LocalDateTime from, LocalDateTime to);
}
