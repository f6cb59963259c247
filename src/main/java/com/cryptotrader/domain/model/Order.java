package com.cryptotrader.domain.model;

import com.cryptotrader.domain.enums.OrderSide;
import com.cryptotrader.domain.enums.OrderStatus;
import com.cryptotrader.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** An order as acknowledged by the trading service. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    private String id;
    private String exchangeOrderId;
    private String strategyId;
    private String exchange;
    private String symbol;
    private OrderSide side;
    private OrderType type;
    private OrderStatus status;
    private BigDecimal quantity;
    private BigDecimal price;

    @Builder.Default
    private BigDecimal filledQuantity = BigDecimal.ZERO;

    private BigDecimal averagePrice;
    private String rejectionReason;
    private Instant createdAt;
}
