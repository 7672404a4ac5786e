package com.arbtrader.event;

import com.arbtrader.domain.model.AccountChange;
import org.springframework.context.ApplicationEvent;

public class AccountChangedEvent extends ApplicationEvent {

    private final AccountChange accountChange;

    public AccountChangedEvent(Object source, AccountChange accountChange) {
        super(source);
        this.accountChange = accountChange;
    }

    public AccountChange getAccountChange() {
        return accountChange;
    }
}
