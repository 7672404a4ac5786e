package com.arbtrader.broker;

import com.arbtrader.domain.model.CashBalance;
import com.arbtrader.domain.model.Holding;
import com.arbtrader.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Portfolio value and buying power read from the account's brokerage connection.
 * Cash balances are summed across currencies without conversion.
 */
@Component
public class BrokerageAccountPortfolioProvider implements AccountPortfolioProvider {

    private final MultiBrokerageManager multiBrokerageManager;

    public BrokerageAccountPortfolioProvider(MultiBrokerageManager multiBrokerageManager) {
        this.multiBrokerageManager = multiBrokerageManager;
    }

    @Override
    public BigDecimal getTotalPortfolioValue(String account) {
        BrokerageConnection connection = requireConnection(account);
        BigDecimal holdings = BigDecimal.ZERO;
        for (Holding holding : connection.getAccountHoldings()) {
            holdings = holdings.add(holding.getMarketValue());
        }
        return cash(connection).add(holdings);
    }

    @Override
    public BigDecimal getBuyingPower(String account) {
        return cash(requireConnection(account)).max(BigDecimal.ZERO);
    }

    private BrokerageConnection requireConnection(String account) {
        return multiBrokerageManager
                .getBrokerage(account)
                .orElseThrow(() -> new ResourceNotFoundException("Brokerage account", account));
    }

    private static BigDecimal cash(BrokerageConnection connection) {
        BigDecimal total = BigDecimal.ZERO;
        for (CashBalance balance : connection.getCashBalance()) {
            if (balance.getAmount() != null) {
                total = total.add(balance.getAmount());
            }
        }
        return total;
    }
}
