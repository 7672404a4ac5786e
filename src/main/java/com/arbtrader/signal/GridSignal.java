package com.arbtrader.signal;

import com.arbtrader.domain.enums.LevelType;
import com.arbtrader.domain.enums.SignalDirection;
import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.exception.ValidationException;
import com.arbtrader.grid.GridLevel;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.Builder;
import lombok.Getter;

/**
 * Single-leg signal emitted when a grid level triggers.
 *
 * <p>The signal names only leg1; the pairing with leg2 and the level pair travel in the tag.
 * A signal is active until its close time. Cancelling moves the close time into the past.
 */
@Getter
public class GridSignal {

    private final String id;
    private final InstrumentId instrument;
    private final SignalDirection direction;
    private final LevelType type;
    private final GridLevel level;
    private final String tag;
    private final LocalDateTime generatedTime;
    private final Duration period;
    private final String sourceModel;
    private final BigDecimal confidence;

    private volatile LocalDateTime closeTime;

    @Builder
    public GridSignal(
            String id,
            InstrumentId instrument,
            SignalDirection direction,
            LevelType type,
            GridLevel level,
            String tag,
            LocalDateTime generatedTime,
            Duration period,
            String sourceModel,
            BigDecimal confidence) {
        if (instrument == null) {
            throw new ValidationException("instrument", "Signal instrument is required");
        }
        if (direction == null || type == null) {
            throw new ValidationException("direction", "Signal direction and type are required");
        }
        if (generatedTime == null || period == null || period.isNegative() || period.isZero()) {
            throw new ValidationException("period", "Signal needs a generated time and a positive period");
        }
        if (confidence != null && (confidence.signum() < 0 || confidence.compareTo(BigDecimal.ONE) > 0)) {
            throw new ValidationException("confidence", "Signal confidence must be within [0, 1], got " + confidence);
        }
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.instrument = instrument;
        this.direction = direction;
        this.type = type;
        this.level = level;
        this.tag = tag;
        this.generatedTime = generatedTime;
        this.period = period;
        this.sourceModel = sourceModel;
        this.confidence = confidence;
        this.closeTime = generatedTime.plus(period);
    }

    public boolean isActive(LocalDateTime now) {
        return now.isBefore(closeTime);
    }

    public boolean isExpired(LocalDateTime now) {
        return !isActive(now);
    }

    public void cancel(LocalDateTime now) {
        closeTime = now.minusSeconds(1);
    }

    public boolean hasTag() {
        return tag != null && !tag.isBlank();
    }

    @Override
    public String toString() {
        return "GridSignal{" + instrument + " " + direction + " " + type + " level=" + level + "}";
    }
}
