package com.arbtrader.domain.model;

import com.arbtrader.domain.enums.SecurityType;
import com.arbtrader.exception.ValidationException;
import java.util.Locale;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Identifies a tradable instrument by asset class, market and ticker.
 *
 * <p>The canonical key is {@code TYPE:market:ticker} (e.g. {@code CRYPTO:binance:BTCUSDT}).
 * Market names are lower-cased so that routing and equality do not depend on how a venue is spelled
 * in configuration. Tickers keep their case. Neither part may contain {@code ':'} or {@code '|'}
 * since both characters are separators in instrument keys and pairing tags.
 */
@Getter
@EqualsAndHashCode
public final class InstrumentId {

    private static final String KEY_SEPARATOR = ":";

    private final SecurityType securityType;
    private final String market;
    private final String ticker;

    public InstrumentId(SecurityType securityType, String market, String ticker) {
        if (securityType == null) {
            throw new ValidationException("securityType", "Instrument security type is required");
        }
        this.securityType = securityType;
        this.market = requirePart("market", market).toLowerCase(Locale.ROOT);
        this.ticker = requirePart("ticker", ticker);
    }

    public static InstrumentId of(SecurityType securityType, String market, String ticker) {
        return new InstrumentId(securityType, market, ticker);
    }

    /**
     * Parses a canonical key produced by {@link #toKey()}.
     *
     * @throws ValidationException if the key does not have exactly three parts or names an unknown type
     */
    public static InstrumentId parse(String key) {
        if (key == null || key.isBlank()) {
            throw new ValidationException("instrument", "Instrument key is blank");
        }
        String[] parts = key.split(KEY_SEPARATOR, -1);
        if (parts.length != 3) {
            throw new ValidationException("instrument", "Instrument key must be TYPE:market:ticker, got: " + key);
        }
        SecurityType type;
        try {
            type = SecurityType.valueOf(parts[0].trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("instrument", "Unknown security type in instrument key: " + key);
        }
        return new InstrumentId(type, parts[1].trim(), parts[2].trim());
    }

    public String toKey() {
        return securityType.name() + KEY_SEPARATOR + market + KEY_SEPARATOR + ticker;
    }

    @Override
    public String toString() {
        return toKey();
    }

    private static String requirePart(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name, "Instrument " + name + " is required");
        }
        if (value.contains(KEY_SEPARATOR) || value.contains("|")) {
            throw new ValidationException(name, "Instrument " + name + " must not contain ':' or '|': " + value);
        }
        return value;
    }
}
