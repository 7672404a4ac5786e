package com.arbtrader.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;

import com.arbtrader.domain.enums.OrderSide;
import com.arbtrader.domain.enums.OrderStatus;
import com.arbtrader.domain.enums.OrderType;
import com.arbtrader.domain.enums.SecurityType;
import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.domain.model.Order;
import com.arbtrader.ledger.ArbitrageTarget;
import com.arbtrader.ledger.ArbitrageTargetLedger;
import com.arbtrader.ledger.LegTarget;
import com.arbtrader.ledger.TradedQuantityProvider;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ArbitrageTargetLedger covering tag-keyed storage, the lot-size fulfilment
 * tolerance and isolation between tags on the same instrument.
 */
class ArbitrageTargetLedgerTest {

    private static final InstrumentId AAPL = InstrumentId.of(SecurityType.EQUITY, "nasdaq", "AAPL");
    private static final InstrumentId AAPL_X = InstrumentId.of(SecurityType.CRYPTO, "binance", "AAPLUSDT");
    private static final String TAG_A = "GT1|level-a";
    private static final String TAG_B = "GT1|level-b";

    private ArbitrageTargetLedger ledger;
    private Map<String, BigDecimal> traded;
    private TradedQuantityProvider tradedQuantities;

    @BeforeEach
    void setUp() {
        ledger = new ArbitrageTargetLedger();
        traded = new HashMap<>();
        tradedQuantities = (tag, instrument) -> traded.getOrDefault(tag + "/" + instrument, BigDecimal.ZERO);
    }

    private void setTraded(String tag, InstrumentId instrument, String quantity) {
        traded.put(tag + "/" + instrument, new BigDecimal(quantity));
    }

    private static ArbitrageTarget target(String tag, String leg1Qty, String leg2Qty) {
        return new ArbitrageTarget(
                tag,
                List.of(
                        new LegTarget(AAPL, new BigDecimal(leg1Qty), BigDecimal.ONE),
                        new LegTarget(AAPL_X, new BigDecimal(leg2Qty), new BigDecimal("0.01"))));
    }

    private static Order openOrder(String tag, InstrumentId instrument, OrderSide side, String qty) {
        return Order.builder()
                .id("o-" + tag)
                .instrument(instrument)
                .side(side)
                .type(OrderType.MARKET)
                .quantity(new BigDecimal(qty))
                .status(OrderStatus.SUBMITTED)
                .tag(tag)
                .build();
    }

    @Nested
    @DisplayName("Storage")
    class Storage {

        @Test
        @DisplayName("Upsert replaces the target for the same tag")
        void upsertReplaces() {
            ledger.upsert(target(TAG_A, "10", "-10"));
            ledger.upsert(target(TAG_A, "0", "0"));

            assertThat(ledger.size()).isEqualTo(1);
            assertThat(ledger.get(TAG_A).orElseThrow().getLegs().get(0).getQuantity()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Targets on the same instrument with different tags coexist")
        void tagsCoexist() {
            ledger.addAll(List.of(target(TAG_A, "10", "-10"), target(TAG_B, "5", "-5")));

            assertThat(ledger.getTargets()).extracting(ArbitrageTarget::getTag).containsExactlyInAnyOrder(TAG_A, TAG_B);
        }

        @Test
        @DisplayName("Snapshot is not affected by later changes")
        void snapshot() {
            ledger.upsert(target(TAG_A, "10", "-10"));
            List<ArbitrageTarget> snapshot = ledger.getTargets();

            ledger.clear();

            assertThat(snapshot).hasSize(1);
            assertThat(ledger.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("Fulfilment")
    class Fulfilment {

        @Test
        @DisplayName("Difference below one lot on every leg is fulfilled")
        void withinTolerance() {
            setTraded(TAG_A, AAPL, "9.5");
            setTraded(TAG_A, AAPL_X, "-9.995");

            assertThat(ledger.isFulfilled(target(TAG_A, "10", "-10"), tradedQuantities, List.of())).isTrue();
        }

        @Test
        @DisplayName("Difference of exactly one lot is not fulfilled")
        void exactlyOneLot() {
            setTraded(TAG_A, AAPL, "9");
            setTraded(TAG_A, AAPL_X, "-10");

            assertThat(ledger.isFulfilled(target(TAG_A, "10", "-10"), tradedQuantities, List.of())).isFalse();
        }

        @Test
        @DisplayName("Open order with the same tag keeps the target outstanding")
        void openOrderSameTag() {
            setTraded(TAG_A, AAPL, "10");
            setTraded(TAG_A, AAPL_X, "-10");
            List<Order> openOrders = List.of(openOrder(TAG_A, AAPL, OrderSide.BUY, "5"));

            assertThat(ledger.isFulfilled(target(TAG_A, "10", "-10"), tradedQuantities, openOrders)).isFalse();
        }

        @Test
        @DisplayName("Open orders and fills of other tags on the same instrument are ignored")
        void otherTagsIgnored() {
            setTraded(TAG_A, AAPL, "10");
            setTraded(TAG_A, AAPL_X, "-10");
            setTraded(TAG_B, AAPL, "500");
            List<Order> openOrders = List.of(openOrder(TAG_B, AAPL, OrderSide.SELL, "50"));

            assertThat(ledger.isFulfilled(target(TAG_A, "10", "-10"), tradedQuantities, openOrders)).isTrue();
        }

        @Test
        @DisplayName("Clear fulfilled removes only the fulfilled targets")
        void clearFulfilled() {
            ledger.addAll(List.of(target(TAG_A, "10", "-10"), target(TAG_B, "5", "-5")));
            setTraded(TAG_A, AAPL, "10");
            setTraded(TAG_A, AAPL_X, "-10");

            List<ArbitrageTarget> cleared = ledger.clearFulfilled(tradedQuantities, List.of());

            assertThat(cleared).extracting(ArbitrageTarget::getTag).containsExactly(TAG_A);
            assertThat(ledger.get(TAG_A)).isEmpty();
            assertThat(ledger.get(TAG_B)).isPresent();
        }

        @Test
        @DisplayName("Open quantity is signed by side and net of fills")
        void openQuantity() {
            Order sell = openOrder(TAG_A, AAPL, OrderSide.SELL, "8");
            sell.setFilledQuantity(new BigDecimal("3"));

            BigDecimal open = ArbitrageTargetLedger.openQuantity(
                    List.of(sell, openOrder(TAG_A, AAPL, OrderSide.BUY, "2")), TAG_A, AAPL);

            assertThat(open).isEqualByComparingTo("-3");
        }
    }
}
