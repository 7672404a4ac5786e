package com.arbtrader.oms.routing;

import com.arbtrader.domain.model.Order;
import java.util.Map;
import java.util.TreeMap;

/** Routes by the instrument's market. Market names match case-insensitively. */
public class MarketOrderRouter extends MappingOrderRouter<String> {

    public MarketOrderRouter(Map<String, String> marketToAccount, String defaultAccount) {
        super(caseInsensitive(marketToAccount), defaultAccount);
    }

    @Override
    protected String keyOf(Order order) {
        return order.getInstrument().getMarket();
    }

    private static Map<String, String> caseInsensitive(Map<String, String> source) {
        Map<String, String> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (source != null) {
            map.putAll(source);
        }
        return map;
    }
}
