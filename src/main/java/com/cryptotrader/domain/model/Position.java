package com.cryptotrader.domain.model;

import com.cryptotrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An open position on one exchange, as tracked by the risk engine.
 *
 * <p>Positions are keyed by {@code exchange:symbol}. The engine never hands out the
 * instances it stores; callers always receive a {@link #copy()}.
 *
 * <p>{@code highestPrice} is the best price seen for the position's side: the peak
 * for BUY positions and the trough for SELL positions. It drives the trailing stop.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String symbol;
    private String exchange;
    private OrderSide side;

    private BigDecimal entryPrice;
    private BigDecimal currentPrice;

    /** Absolute base-asset quantity. */
    private BigDecimal quantity;

    /** Notional in quote currency (quantity * current price). */
    private BigDecimal value;

    private BigDecimal unrealizedPnl;

    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    private Instant entryTimestamp;

    /** Best price seen for this side; null until the engine has tracked at least one price. */
    private BigDecimal highestPrice;

    public static String keyOf(String exchange, String symbol) {
        return exchange + ":" + symbol;
    }

    public String key() {
        return keyOf(exchange, symbol);
    }

    public Position copy() {
        return toBuilder().build();
    }

    /**
     * Returns a copy marked to the given price: current price, notional value and
     * unrealized P&L are recomputed for the position's side.
     */
    public Position withMarkPrice(BigDecimal price) {
        Position marked = copy();
        marked.setCurrentPrice(price);
        if (quantity != null) {
            marked.setValue(quantity.multiply(price));
            if (entryPrice != null) {
                BigDecimal perUnit = side == OrderSide.SELL ? entryPrice.subtract(price) : price.subtract(entryPrice);
                marked.setUnrealizedPnl(perUnit.multiply(quantity));
            }
        }
        return marked;
    }
}
