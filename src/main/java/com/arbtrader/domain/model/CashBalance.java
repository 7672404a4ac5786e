package com.arbtrader.domain.model;

import java.math.BigDecimal;
import lombok.Value;

@Value
public class CashBalance {

    String currency;
    BigDecimal amount;
}
