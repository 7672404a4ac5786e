package com.arbtrader.grid;

import com.arbtrader.domain.enums.LevelType;
import com.arbtrader.domain.enums.SpreadDirection;
import com.arbtrader.exception.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Value;

/**
 * One configured trigger rule of a spread grid: threshold, direction, type and size.
 *
 * <p>Decimal values are normalized with {@link BigDecimal#stripTrailingZeros()} so that
 * {@code -0.02} and {@code -0.0200} produce equal levels. Equality covers all four fields.
 *
 * <p>The natural key is only unique inside one trading pair; two pairs can carry the same
 * level configuration.
 */
@Value
public class GridLevel {

    /** Spread value at which this level fires, as a fraction (-0.02 = -2%). */
    BigDecimal spreadThreshold;

    SpreadDirection direction;
    LevelType type;

    /** Signed fraction of portfolio value allocated to this level. */
    BigDecimal positionSize;

    public GridLevel(BigDecimal spreadThreshold, SpreadDirection direction, LevelType type, BigDecimal positionSize) {
        if (spreadThreshold == null) {
            throw new ValidationException("spreadThreshold", "Grid level spread threshold is required");
        }
        if (direction == null) {
            throw new ValidationException("direction", "Grid level direction must be LONG_SPREAD or SHORT_SPREAD");
        }
        if (type == null) {
            throw new ValidationException("type", "Grid level type must be ENTRY or EXIT");
        }
        if (positionSize == null) {
            throw new ValidationException("positionSize", "Grid level position size is required");
        }
        this.spreadThreshold = spreadThreshold.stripTrailingZeros();
        this.direction = direction;
        this.type = type;
        this.positionSize = positionSize.stripTrailingZeros();
    }

    /** Deterministic key of the form {@code -0.0200|LONG_SPREAD|ENTRY}. */
    public String getNaturalKey() {
        return spreadThreshold.setScale(4, RoundingMode.HALF_UP).toPlainString() + "|" + direction + "|" + type;
    }

    @Override
    public String toString() {
        return getNaturalKey() + "|" + positionSize.toPlainString();
    }
}
