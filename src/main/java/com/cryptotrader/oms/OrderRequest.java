package com.cryptotrader.oms;

import com.cryptotrader.domain.enums.OrderSide;
import com.cryptotrader.domain.enums.OrderType;
import com.cryptotrader.exception.ValidationException;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Data;

/**
 * Everything the {@link TradingService} needs to place one order.
 *
 * <p>{@code price} is the limit price and is required for LIMIT orders only.
 * {@code referencePrice} is the last known market price; it sizes the pre-trade
 * exposure check and is the fill price used by paper trading for MARKET orders.
 */
@Data
@Builder
public class OrderRequest {

    private String exchange;
    private String symbol;
    private OrderSide side;

    @Builder.Default
    private OrderType type = OrderType.MARKET;

    private BigDecimal quantity;
    private BigDecimal price;
    private BigDecimal referencePrice;

    @Builder.Default
    private Duration timeout = Duration.ofSeconds(30);

    /** Strategy that produced the order. Null for orders placed by the risk layer. */
    private String strategyId;

    private String clientOrderId;

    /**
     * Checks the request is placeable: positive quantity, a positive limit price
     * for LIMIT orders and a positive timeout.
     *
     * @throws ValidationException describing the first problem found
     */
    public void validate() {
        if (exchange == null || symbol == null || side == null) {
            throw new ValidationException("Order requires exchange, symbol and side");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new ValidationException("Order quantity must be positive, got " + quantity);
        }
        if (type == OrderType.LIMIT && price == null) {
            throw new ValidationException("Price is required for LIMIT orders");
        }
        if (price != null && price.signum() <= 0) {
            throw new ValidationException("Order price must be positive, got " + price);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ValidationException("Order timeout must be positive, got " + timeout);
        }
    }

    /** Price used to value the order: the limit price when set, else the reference price. */
    public BigDecimal effectivePrice() {
        return price != null ? price : referencePrice;
    }
}
