package com.arbtrader.grid;

import com.arbtrader.domain.enums.MarketState;
import com.arbtrader.domain.enums.SpreadDirection;
import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.domain.model.Quote;
import com.arbtrader.domain.model.Security;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two legs, their derived spread state, and the grid attached to them.
 *
 * <p>Spread definitions:
 * <ul>
 *   <li>short spread = (leg1 bid - leg2 ask) / leg1 bid: sell leg1, buy leg2</li>
 *   <li>long spread = (leg1 ask - leg2 bid) / leg1 ask: buy leg1, sell leg2</li>
 *   <li>theoretical spread = whichever of the two has the larger magnitude, sign kept</li>
 * </ul>
 *
 * <p>Spread state is recomputed by {@link #update} on the evaluation thread only. The grid state
 * (configured level pairs and the positions keyed by entry natural key) is also mutated from
 * brokerage threads through fill processing, so both live in concurrent collections.
 */
public class TradingPair {

    private static final Logger log = LoggerFactory.getLogger(TradingPair.class);

    private static final BigDecimal MIN_PRICE = new BigDecimal("1e-10");

    private final Security leg1;
    private final Security leg2;
    private final String pairType;

    private final List<GridLevelPair> levelPairs = new CopyOnWriteArrayList<>();
    private final ConcurrentMap<String, GridPosition> positions = new ConcurrentHashMap<>();

    private volatile MarketState marketState = MarketState.UNKNOWN;
    private volatile SpreadDirection direction;
    private volatile BigDecimal shortSpread;
    private volatile BigDecimal longSpread;
    private volatile BigDecimal theoreticalSpread;
    private volatile BigDecimal executableSpread;
    private volatile LocalDateTime lastUpdate;

    public TradingPair(Security leg1, Security leg2, String pairType) {
        this.leg1 = leg1;
        this.leg2 = leg2;
        this.pairType = pairType;
    }

    public TradingPairKey getKey() {
        return new TradingPairKey(leg1.getInstrument(), leg2.getInstrument());
    }

    // ---- Spread state ----

    /** Recomputes spreads, market state and direction from the legs' current quotes. */
    public void update(LocalDateTime now) {
        Quote q1 = leg1.getQuote();
        Quote q2 = leg2.getQuote();
        lastUpdate = now;
        if (!isValid(q1) || !isValid(q2)) {
            marketState = MarketState.UNKNOWN;
            direction = null;
            shortSpread = null;
            longSpread = null;
            theoreticalSpread = null;
            executableSpread = null;
            return;
        }

        BigDecimal l1Bid = q1.getBid();
        BigDecimal l1Ask = q1.getAsk();
        BigDecimal l2Bid = q2.getBid();
        BigDecimal l2Ask = q2.getAsk();

        BigDecimal shortValue = ratio(l1Bid.subtract(l2Ask), l1Bid);
        BigDecimal longValue = ratio(l1Ask.subtract(l2Bid), l1Ask);
        shortSpread = shortValue;
        longSpread = longValue;
        theoreticalSpread = shortValue.abs().compareTo(longValue.abs()) >= 0 ? shortValue : longValue;

        if (l1Bid.compareTo(l2Ask) > 0) {
            marketState = MarketState.CROSSED;
            direction = SpreadDirection.SHORT_SPREAD;
            executableSpread = shortValue;
        } else if (l2Bid.compareTo(l1Ask) > 0) {
            marketState = MarketState.CROSSED;
            direction = SpreadDirection.LONG_SPREAD;
            executableSpread = longValue;
        } else if (l1Ask.compareTo(l2Ask) > 0 && l2Ask.compareTo(l1Bid) > 0 && l1Bid.compareTo(l2Bid) > 0) {
            marketState = MarketState.LIMIT_OPPORTUNITY;
            direction = SpreadDirection.SHORT_SPREAD;
            executableSpread = ratio(l1Ask.subtract(l2Ask), l1Ask).max(ratio(l1Bid.subtract(l2Bid), l1Bid));
        } else if (l2Ask.compareTo(l1Ask) > 0 && l1Ask.compareTo(l2Bid) > 0 && l2Bid.compareTo(l1Bid) > 0) {
            marketState = MarketState.LIMIT_OPPORTUNITY;
            direction = SpreadDirection.LONG_SPREAD;
            executableSpread = ratio(l1Ask.subtract(l2Bid), l1Ask).min(ratio(l1Bid.subtract(l2Ask), l1Bid));
        } else {
            marketState = MarketState.NO_OPPORTUNITY;
            direction = null;
            executableSpread = null;
        }
    }

    /** All four prices positive and neither leg's book inverted. */
    public boolean hasValidPrices() {
        return isValid(leg1.getQuote()) && isValid(leg2.getQuote());
    }

    // ---- Grid configuration ----

    /** Adds a level pair unless an equal one is already configured. */
    public boolean addLevelPair(GridLevelPair levelPair) {
        if (levelPairs.contains(levelPair)) {
            return false;
        }
        levelPairs.add(levelPair);
        log.debug("Added level pair {} to {}", levelPair.getEntry().getNaturalKey(), getKey());
        return true;
    }

    public boolean removeLevelPair(GridLevelPair levelPair) {
        return levelPairs.remove(levelPair);
    }

    public List<GridLevelPair> getLevelPairs() {
        return List.copyOf(levelPairs);
    }

    // ---- Grid positions ----

    public GridPosition getOrCreatePosition(GridLevelPair levelPair, LocalDateTime now) {
        return positions.computeIfAbsent(
                levelPair.getEntry().getNaturalKey(),
                key -> new GridPosition(
                        leg1.getInstrument(),
                        leg2.getInstrument(),
                        leg1.getLotSize(),
                        leg2.getLotSize(),
                        levelPair,
                        now));
    }

    public Optional<GridPosition> findPosition(GridLevelPair levelPair) {
        return Optional.ofNullable(positions.get(levelPair.getEntry().getNaturalKey()));
    }

    public Optional<GridPosition> removePosition(GridLevelPair levelPair) {
        return Optional.ofNullable(positions.remove(levelPair.getEntry().getNaturalKey()));
    }

    /** Removes the position only if it is still the given instance. */
    public boolean removePosition(GridPosition position) {
        return positions.remove(position.getLevelPair().getEntry().getNaturalKey(), position);
    }

    /** Installs a position rebuilt from a backup, replacing any position on the same entry level. */
    public void restorePosition(GridPosition position) {
        positions.put(position.getLevelPair().getEntry().getNaturalKey(), position);
    }

    public List<GridPosition> getPositions() {
        return List.copyOf(positions.values());
    }

    // ---- Accessors ----

    public Security getLeg1() {
        return leg1;
    }

    public Security getLeg2() {
        return leg2;
    }

    public InstrumentId getLeg1Id() {
        return leg1.getInstrument();
    }

    public InstrumentId getLeg2Id() {
        return leg2.getInstrument();
    }

    public boolean involves(InstrumentId instrument) {
        return leg1.getInstrument().equals(instrument) || leg2.getInstrument().equals(instrument);
    }

    public String getPairType() {
        return pairType;
    }

    public MarketState getMarketState() {
        return marketState;
    }

    /** Arbitrage direction from the last update; null without an opportunity. */
    public SpreadDirection getDirection() {
        return direction;
    }

    public BigDecimal getShortSpread() {
        return shortSpread;
    }

    public BigDecimal getLongSpread() {
        return longSpread;
    }

    public BigDecimal getTheoreticalSpread() {
        return theoreticalSpread;
    }

    /** Spread capturable in the current market state; null when there is nothing to capture. */
    public BigDecimal getExecutableSpread() {
        return executableSpread;
    }

    public LocalDateTime getLastUpdate() {
        return lastUpdate;
    }

    @Override
    public String toString() {
        return "TradingPair{" + getKey() + ", type=" + pairType + ", state=" + marketState + "}";
    }

    private static boolean isValid(Quote quote) {
        BigDecimal bid = quote.getBid();
        BigDecimal ask = quote.getAsk();
        return bid != null
                && ask != null
                && bid.compareTo(MIN_PRICE) > 0
                && ask.compareTo(MIN_PRICE) > 0
                && bid.compareTo(ask) <= 0;
    }

    private static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        return numerator.divide(denominator, MathContext.DECIMAL64);
    }
}
