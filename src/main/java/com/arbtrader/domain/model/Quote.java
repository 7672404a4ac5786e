package com.arbtrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Value;

/** Top-of-book snapshot for one instrument. */
@Value
public class Quote {

    BigDecimal bid;
    BigDecimal ask;
    LocalDateTime time;

    public static Quote empty() {
        return new Quote(null, null, null);
    }
}
