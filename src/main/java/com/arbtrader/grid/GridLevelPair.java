package com.arbtrader.grid;

import com.arbtrader.domain.enums.LevelType;
import com.arbtrader.domain.enums.SpreadDirection;
import com.arbtrader.exception.ValidationException;
import java.math.BigDecimal;
import lombok.Value;

/**
 * An entry level and the exit level that closes it.
 *
 * <p>Construction fails unless:
 * <ul>
 *   <li>LONG_SPREAD: entry threshold &lt; 0 and exit threshold &gt; entry threshold</li>
 *   <li>SHORT_SPREAD: entry threshold &gt; 0 and exit threshold &lt; entry threshold</li>
 *   <li>the exit has the opposite direction, type EXIT and the negated entry size</li>
 * </ul>
 */
@Value
public class GridLevelPair {

    GridLevel entry;
    GridLevel exit;

    public GridLevelPair(GridLevel entry, GridLevel exit) {
        if (entry == null || entry.getType() != LevelType.ENTRY) {
            throw new ValidationException("entry", "Level pair entry must be an ENTRY level");
        }
        if (exit == null || exit.getType() != LevelType.EXIT) {
            throw new ValidationException("exit", "Level pair exit must be an EXIT level");
        }
        if (exit.getDirection() != entry.getDirection().opposite()) {
            throw new ValidationException(
                    "exit.direction",
                    "Exit direction must be " + entry.getDirection().opposite() + ", got " + exit.getDirection());
        }
        if (exit.getPositionSize().compareTo(entry.getPositionSize().negate()) != 0) {
            throw new ValidationException(
                    "exit.positionSize",
                    "Exit position size must be " + entry.getPositionSize().negate().toPlainString() + ", got "
                            + exit.getPositionSize().toPlainString());
        }
        validateThresholds(entry.getDirection(), entry.getSpreadThreshold(), exit.getSpreadThreshold());
        this.entry = entry;
        this.exit = exit;
    }

    /** Builds the pair from its entry configuration; the exit level is derived. */
    public static GridLevelPair of(
            SpreadDirection direction, BigDecimal entryThreshold, BigDecimal exitThreshold, BigDecimal positionSize) {
        if (direction == null) {
            throw new ValidationException("direction", "Level pair direction must be LONG_SPREAD or SHORT_SPREAD");
        }
        if (positionSize == null) {
            throw new ValidationException("positionSize", "Level pair position size is required");
        }
        GridLevel entry = new GridLevel(entryThreshold, direction, LevelType.ENTRY, positionSize);
        GridLevel exit = new GridLevel(exitThreshold, direction.opposite(), LevelType.EXIT, positionSize.negate());
        return new GridLevelPair(entry, exit);
    }

    public SpreadDirection getDirection() {
        return entry.getDirection();
    }

    private static void validateThresholds(
            SpreadDirection direction, BigDecimal entryThreshold, BigDecimal exitThreshold) {
        if (direction == SpreadDirection.LONG_SPREAD) {
            if (entryThreshold.signum() >= 0) {
                throw new ValidationException(
                        "entryThreshold",
                        "LONG_SPREAD entry threshold must be negative, got " + entryThreshold.toPlainString());
            }
            if (exitThreshold.compareTo(entryThreshold) <= 0) {
                throw new ValidationException(
                        "exitThreshold",
                        "LONG_SPREAD exit threshold " + exitThreshold.toPlainString()
                                + " must be greater than entry threshold " + entryThreshold.toPlainString());
            }
        } else {
            if (entryThreshold.signum() <= 0) {
                throw new ValidationException(
                        "entryThreshold",
                        "SHORT_SPREAD entry threshold must be positive, got " + entryThreshold.toPlainString());
            }
            if (exitThreshold.compareTo(entryThreshold) >= 0) {
                throw new ValidationException(
                        "exitThreshold",
                        "SHORT_SPREAD exit threshold " + exitThreshold.toPlainString()
                                + " must be less than entry threshold " + entryThreshold.toPlainString());
            }
        }
    }
}
