package com.arbtrader.oms.routing;

import com.arbtrader.domain.model.Order;

/** Sends every order to one account. */
public class SimpleOrderRouter implements OrderRouter {

    private final String account;

    public SimpleOrderRouter(String account) {
        this.account = account;
    }

    @Override
    public String route(Order order) {
        return account;
    }

    @Override
    public boolean validate() {
        return account != null && !account.isBlank();
    }

    @Override
    public String describeProblem() {
        return validate() ? null : "account is not set";
    }
}
