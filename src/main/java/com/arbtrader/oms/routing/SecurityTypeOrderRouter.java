package com.arbtrader.oms.routing;

import com.arbtrader.domain.enums.SecurityType;
import com.arbtrader.domain.model.Order;
import java.util.EnumMap;
import java.util.Map;

/** Routes by asset class, e.g. crypto to an exchange account and equities to a stock broker. */
public class SecurityTypeOrderRouter extends MappingOrderRouter<SecurityType> {

    public SecurityTypeOrderRouter(Map<SecurityType, String> typeToAccount, String defaultAccount) {
        super(copy(typeToAccount), defaultAccount);
    }

    @Override
    protected SecurityType keyOf(Order order) {
        return order.getInstrument().getSecurityType();
    }

    private static Map<SecurityType, String> copy(Map<SecurityType, String> source) {
        Map<SecurityType, String> map = new EnumMap<>(SecurityType.class);
        if (source != null) {
            map.putAll(source);
        }
        return map;
    }
}
