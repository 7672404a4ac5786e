package com.arbtrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Cash balance change reported by a brokerage connection. */
@Value
@Builder(toBuilder = true)
public class AccountChange {

    String account;
    String currency;
    BigDecimal cashBalance;
}
