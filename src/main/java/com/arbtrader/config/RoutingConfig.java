package com.arbtrader.config;

import com.arbtrader.domain.enums.SecurityType;
import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.exception.RoutingConfigurationException;
import com.arbtrader.oms.routing.InstrumentOrderRouter;
import com.arbtrader.oms.routing.MarketOrderRouter;
import com.arbtrader.oms.routing.OrderRouter;
import com.arbtrader.oms.routing.SecurityTypeOrderRouter;
import com.arbtrader.oms.routing.SimpleOrderRouter;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link OrderRouter} bean from {@code arbtrader.routing.*}.
 *
 * <p>The router is validated here, so an empty mapping table or a missing default account
 * stops the application before any trading.
 */
@Configuration
public class RoutingConfig {

    private static final Logger log = LoggerFactory.getLogger(RoutingConfig.class);

    @Bean
    public OrderRouter orderRouter(ArbitrageProperties arbitrageProperties) {
        OrderRouter router = createRouter(arbitrageProperties.getRouting());
        router.ensureValid();
        log.info("Order routing: {}", router.getClass().getSimpleName());
        return router;
    }

    private static OrderRouter createRouter(ArbitrageProperties.Routing routing) {
        String type = routing.getType() != null ? routing.getType().trim().toUpperCase(Locale.ROOT) : "SIMPLE";
        Map<String, String> mappings = routing.getMappings() != null ? routing.getMappings() : Map.of();
        return switch (type) {
            case "SIMPLE" -> new SimpleOrderRouter(routing.getDefaultAccount());
            case "MARKET" -> new MarketOrderRouter(mappings, routing.getDefaultAccount());
            case "INSTRUMENT" -> {
                Map<InstrumentId, String> byInstrument = new HashMap<>();
                mappings.forEach((key, account) -> byInstrument.put(InstrumentId.parse(key), account));
                yield new InstrumentOrderRouter(byInstrument, routing.getDefaultAccount());
            }
            case "SECURITY_TYPE" -> {
                Map<SecurityType, String> byType = new EnumMap<>(SecurityType.class);
                mappings.forEach((key, account) ->
                        byType.put(SecurityType.valueOf(key.trim().toUpperCase(Locale.ROOT)), account));
                yield new SecurityTypeOrderRouter(byType, routing.getDefaultAccount());
            }
            default -> throw new RoutingConfigurationException("Unknown router type: " + routing.getType());
        };
    }
}
