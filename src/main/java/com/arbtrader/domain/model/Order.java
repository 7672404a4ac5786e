package com.arbtrader.domain.model;

import com.arbtrader.domain.enums.OrderSide;
import com.arbtrader.domain.enums.OrderStatus;
import com.arbtrader.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A brokerage order for a single leg.
 *
 * <p>Quantity is always positive; the side carries the sign. Grid orders carry the pairing tag
 * of the level pair they execute, which is how fills and open orders are attributed back to a
 * specific grid position even when several levels trade the same instrument.
 * The account is assigned by the order router before placement.
 */
@Data
@Builder
public class Order {

    private String id;

    /** Brokerage order id, assigned after successful placement. Null while NEW. */
    private String brokerOrderId;

    private InstrumentId instrument;
    private OrderSide side;
    private OrderType type;
    private BigDecimal quantity;

    /** Limit price. Required for LIMIT orders. */
    private BigDecimal limitPrice;

    @Builder.Default
    private OrderStatus status = OrderStatus.NEW;

    @Builder.Default
    private BigDecimal filledQuantity = BigDecimal.ZERO;

    private BigDecimal averageFillPrice;

    /** Pairing tag of the grid level this order belongs to. Null for manual orders. */
    private String tag;

    /** Account (brokerage connection name) the order was routed to. */
    private String account;

    private LocalDateTime placedAt;
    private LocalDateTime updatedAt;

    /** Unfilled quantity signed by side: positive for buys, negative for sells. */
    public BigDecimal getRemainingSignedQuantity() {
        BigDecimal filled = filledQuantity != null ? filledQuantity : BigDecimal.ZERO;
        BigDecimal remaining = quantity.subtract(filled);
        return side == OrderSide.SELL ? remaining.negate() : remaining;
    }
}
