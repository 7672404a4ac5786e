package com.arbtrader.domain.model;

import com.arbtrader.domain.enums.OrderStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Status or fill notification pushed by a brokerage connection.
 *
 * <p>Fill quantity is signed (positive for buys). The account is stamped by the
 * multi-brokerage manager when the event is forwarded, so connections never need to know
 * the name they were registered under.
 */
@Value
@Builder(toBuilder = true)
public class OrderUpdate {

    String orderId;
    String brokerOrderId;
    InstrumentId instrument;
    OrderStatus status;
    BigDecimal fillPrice;
    BigDecimal fillQuantity;
    String executionId;
    String tag;
    String account;
    LocalDateTime time;
    BigDecimal fee;

    public boolean hasFill() {
        return status != null && status.isFill() && fillQuantity != null && fillQuantity.signum() != 0;
    }
}
