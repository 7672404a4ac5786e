package com.arbtrader.broker;

import java.math.BigDecimal;

/** Per-account capital figures used to size allocation targets. */
public interface AccountPortfolioProvider {

    /** Cash plus market value of holdings. */
    BigDecimal getTotalPortfolioValue(String account);

    BigDecimal getBuyingPower(String account);
}
