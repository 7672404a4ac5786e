package com.arbtrader.domain.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import lombok.Getter;

/**
 * Market data reference for one leg: instrument, lot size and latest quote.
 *
 * <p>The quote is replaced atomically by the data feed, so readers always see a bid and ask
 * that belong to the same update.
 */
public class Security {

    /** Lot size used when the venue does not publish one. */
    public static final BigDecimal DEFAULT_LOT_SIZE = new BigDecimal("0.01");

    @Getter
    private final InstrumentId instrument;

    @Getter
    private final BigDecimal lotSize;

    private volatile Quote quote = Quote.empty();

    public Security(InstrumentId instrument, BigDecimal lotSize) {
        this.instrument = instrument;
        this.lotSize = lotSize != null && lotSize.signum() > 0 ? lotSize : DEFAULT_LOT_SIZE;
    }

    public Security(InstrumentId instrument) {
        this(instrument, DEFAULT_LOT_SIZE);
    }

    public void updateQuote(BigDecimal bid, BigDecimal ask, LocalDateTime time) {
        this.quote = new Quote(bid, ask, time);
    }

    public Quote getQuote() {
        return quote;
    }

    public BigDecimal getBid() {
        return quote.getBid();
    }

    public BigDecimal getAsk() {
        return quote.getAsk();
    }

    /** Mid price of the latest quote, or null when either side is missing. */
    public BigDecimal getMidPrice() {
        Quote current = quote;
        if (current.getBid() == null || current.getAsk() == null) {
            return null;
        }
        return current.getBid().add(current.getAsk()).divide(BigDecimal.valueOf(2), MathContext.DECIMAL64);
    }
}
