package com.arbtrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** One historical execution reported by a brokerage, used to replay fills missed while offline. */
@Value
@Builder
public class ExecutionRecord {

    String executionId;
    String brokerOrderId;
    InstrumentId instrument;

    /** Signed: positive for buys. */
    BigDecimal quantity;

    BigDecimal price;
    LocalDateTime time;
    String tag;
    BigDecimal fee;
    String feeCurrency;
    String account;
}
