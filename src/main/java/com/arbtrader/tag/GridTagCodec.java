package com.arbtrader.tag;

import com.arbtrader.domain.enums.SpreadDirection;
import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.grid.GridLevelPair;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes grid pairing metadata into the tag carried by single-leg signals, allocation targets
 * and orders, and decodes it back without access to the originating trading pair.
 *
 * <p>Format: {@code GT1|leg1|leg2|entryThreshold|exitThreshold|direction|positionSize}, for example
 * {@code GT1|EQUITY:nasdaq:AAPL|CRYPTO:binance:AAPLUSDT|-0.02|0.01|LONG_SPREAD|0.5}.
 * Legs use the instrument key, decimals are written as plain strings without trailing zeros, so
 * encode, decode, encode always reproduces the same string. Leg order is preserved: swapping the
 * legs produces a different tag.
 */
public final class GridTagCodec {

    private static final Logger log = LoggerFactory.getLogger(GridTagCodec.class);

    public static final String VERSION = "GT1";

    private static final String SEPARATOR = "|";
    private static final int FIELD_COUNT = 7;

    private GridTagCodec() {}

    public static String encode(InstrumentId leg1, InstrumentId leg2, GridLevelPair levelPair) {
        return String.join(
                SEPARATOR,
                VERSION,
                leg1.toKey(),
                leg2.toKey(),
                levelPair.getEntry().getSpreadThreshold().toPlainString(),
                levelPair.getExit().getSpreadThreshold().toPlainString(),
                levelPair.getDirection().name(),
                levelPair.getEntry().getPositionSize().toPlainString());
    }

    public static String encode(GridTag tag) {
        return encode(tag.getLeg1(), tag.getLeg2(), tag.getLevelPair());
    }

    /**
     * Decodes a tag. Never throws: malformed input, an unknown version or values that fail level
     * pair validation all yield an empty result.
     */
    public static Optional<GridTag> tryDecode(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String[] parts = tag.split("\\|", -1);
        if (parts.length != FIELD_COUNT || !VERSION.equals(parts[0])) {
            log.debug("Not a grid tag: {}", tag);
            return Optional.empty();
        }
        try {
            InstrumentId leg1 = InstrumentId.parse(parts[1]);
            InstrumentId leg2 = InstrumentId.parse(parts[2]);
            BigDecimal entryThreshold = new BigDecimal(parts[3]);
            BigDecimal exitThreshold = new BigDecimal(parts[4]);
            SpreadDirection direction = SpreadDirection.valueOf(parts[5]);
            BigDecimal positionSize = new BigDecimal(parts[6]);
            GridLevelPair levelPair = GridLevelPair.of(direction, entryThreshold, exitThreshold, positionSize);
            return Optional.of(new GridTag(leg1, leg2, levelPair));
        } catch (RuntimeException e) {
            log.debug("Failed to decode grid tag {}: {}", tag, e.getMessage());
            return Optional.empty();
        }
    }

    public static boolean isGridTag(String tag) {
        return tag != null && tag.startsWith(VERSION + SEPARATOR);
    }
}
