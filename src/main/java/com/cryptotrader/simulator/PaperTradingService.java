package com.cryptotrader.simulator;

import com.cryptotrader.domain.enums.OrderSide;
import com.cryptotrader.domain.enums.OrderStatus;
import com.cryptotrader.domain.enums.OrderType;
import com.cryptotrader.domain.model.Order;
import com.cryptotrader.domain.model.Position;
import com.cryptotrader.exception.ResourceNotFoundException;
import com.cryptotrader.exception.TradingException;
import com.cryptotrader.exception.ValidationException;
import com.cryptotrader.oms.OrderRequest;
import com.cryptotrader.oms.TradingEngine;
import com.cryptotrader.oms.TradingService;
import com.cryptotrader.risk.PositionProvider;
import com.cryptotrader.risk.PriceProvider;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * In-memory paper account: fills MARKET orders immediately at the request's reference
 * price, keeps LIMIT orders open until cancelled, and nets fills into one position per
 * {@code exchange:symbol}.
 *
 * <p>Acts as the {@link TradingService} for the execution pipeline, the {@link TradingEngine}
 * for risk actions and the {@link PositionProvider} for the risk monitor, so a configuration
 * without any exchange account still runs end to end.
 *
 * <p>Position netting: BUY adds to the signed quantity, SELL subtracts. A fill that crosses
 * zero realizes P&L on the closed part and re-opens the remainder at the fill price.
 *
 * <p>Risk-driven closes fill at the latest market price from the {@link PriceProvider},
 * falling back to the position's last mark when no price is known.
 */
@Service
@ConditionalOnProperty(
        prefix = "cryptotrader.paper-trading",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true)
public class PaperTradingService implements TradingService, TradingEngine, PositionProvider {

    private static final Logger log = LoggerFactory.getLogger(PaperTradingService.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Clock clock;
    private final PriceProvider priceProvider;
    private final Map<String, Order> orders = new ConcurrentHashMap<>();
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private volatile Instant blockedUntil;
    private volatile BigDecimal totalRealizedPnl = BigDecimal.ZERO;

    public PaperTradingService(Clock clock) {
        this(clock, null);
    }

    @Autowired
    public PaperTradingService(Clock clock, PriceProvider priceProvider) {
        this.clock = clock;
        this.priceProvider = priceProvider;
    }

    // ========================
    // ORDERS
    // ========================

    @Override
    public Order createOrder(OrderRequest request) {
        request.validate();

        Order order = Order.builder()
                .id(UUID.randomUUID().toString())
                .exchangeOrderId("paper-" + UUID.randomUUID())
                .strategyId(request.getStrategyId())
                .exchange(request.getExchange())
                .symbol(request.getSymbol())
                .side(request.getSide())
                .type(request.getType())
                .quantity(request.getQuantity())
                .price(request.getPrice())
                .createdAt(clock.instant())
                .build();

        if (isTradingBlocked()) {
            order.setStatus(OrderStatus.REJECTED);
            order.setRejectionReason("New trades are blocked");
            orders.put(order.getId(), order);
            log.warn(
                    "Paper order rejected, trading blocked: {} {} {}",
                    request.getSide(),
                    request.getQuantity(),
                    request.getSymbol());
            return order;
        }

        if (request.getType() == OrderType.LIMIT) {
            order.setStatus(OrderStatus.OPEN);
            orders.put(order.getId(), order);
            log.info(
                    "Paper LIMIT order open: {} {} {} @ {}",
                    request.getSide(),
                    request.getQuantity(),
                    request.getSymbol(),
                    request.getPrice());
            return order;
        }

        BigDecimal fillPrice = request.getReferencePrice();
        if (fillPrice == null || fillPrice.signum() <= 0) {
            throw new TradingException("Paper MARKET order for " + request.getSymbol() + " has no reference price");
        }
        fill(order, fillPrice);
        log.info(
                "Paper MARKET order filled: {} {} {} @ {}",
                request.getSide(),
                request.getQuantity(),
                request.getSymbol(),
                fillPrice);
        return order;
    }

    @Override
    public Order cancelOrder(String exchange, String orderId) {
        Order order = orders.get(orderId);
        if (order == null || !order.getExchange().equals(exchange)) {
            throw ResourceNotFoundException.order(exchange, orderId);
        }
        if (order.getStatus().isTerminal()) {
            throw new ValidationException("Order " + orderId + " is already " + order.getStatus());
        }
        order.setStatus(OrderStatus.CANCELED);
        return order;
    }

    @Override
    public Optional<Order> getOrder(String exchange, String orderId) {
        return Optional.ofNullable(orders.get(orderId)).filter(o -> o.getExchange().equals(exchange));
    }

    @Override
    public List<Order> getOpenOrders(String exchange, String symbol) {
        return orders.values().stream()
                .filter(o -> o.getStatus() == OrderStatus.OPEN)
                .filter(o -> o.getExchange().equals(exchange))
                .filter(o -> symbol == null || o.getSymbol().equals(symbol))
                .toList();
    }

    // ========================
    // RISK ACTIONS
    // ========================

    @Override
    public Order closePosition(String exchange, String symbol, String reason, String evaluationId) {
        return partialClosePosition(exchange, symbol, HUNDRED, reason, evaluationId);
    }

    @Override
    public synchronized Order partialClosePosition(
            String exchange, String symbol, BigDecimal percentage, String reason, String evaluationId) {
        if (percentage == null || percentage.signum() <= 0 || percentage.compareTo(HUNDRED) > 0) {
            throw new ValidationException("Close percentage must be in (0, 100], got " + percentage);
        }
        Position position = positions.get(Position.keyOf(exchange, symbol));
        if (position == null) {
            throw ResourceNotFoundException.position(exchange, symbol);
        }

        BigDecimal quantity = percentage.compareTo(HUNDRED) == 0
                ? position.getQuantity()
                : position.getQuantity().multiply(percentage).divide(HUNDRED, MathContext.DECIMAL64);
        Order order = Order.builder()
                .id(UUID.randomUUID().toString())
                .exchangeOrderId("paper-" + UUID.randomUUID())
                .exchange(exchange)
                .symbol(symbol)
                .side(position.getSide().opposite())
                .type(OrderType.MARKET)
                .quantity(quantity)
                .createdAt(clock.instant())
                .build();
        BigDecimal fillPrice = marketPrice(position);
        fill(order, fillPrice);
        log.info(
                "Paper position {} reduced by {}% @ {} ({}), evaluation {}",
                position.key(),
                percentage.stripTrailingZeros().toPlainString(),
                fillPrice,
                reason,
                evaluationId);
        return order;
    }

    @Override
    public synchronized List<Order> closeAllPositions(String reason, String evaluationId) {
        List<Order> closing = new ArrayList<>();
        for (Position position : new ArrayList<>(positions.values())) {
            closing.add(closePosition(position.getExchange(), position.getSymbol(), reason, evaluationId));
        }
        log.warn(
                "Paper account flattened: {} position(s) closed ({}), evaluation {}",
                closing.size(),
                reason,
                evaluationId);
        return closing;
    }

    @Override
    public void blockNewTrades(Duration duration, String reason, String evaluationId) {
        blockedUntil = duration == null ? Instant.MAX : clock.instant().plus(duration);
        log.warn(
                "New paper trades blocked until {} ({}), evaluation {}",
                duration == null ? "resumed" : blockedUntil,
                reason,
                evaluationId);
    }

    @Override
    public boolean isTradingBlocked() {
        Instant until = blockedUntil;
        return until != null && clock.instant().isBefore(until);
    }

    @Override
    public void resumeTrading(String reason) {
        blockedUntil = null;
        log.info("Paper trading resumed ({})", reason);
    }

    // ========================
    // POSITIONS
    // ========================

    @Override
    public synchronized List<Position> fetchPositions() {
        return positions.values().stream().map(Position::copy).toList();
    }

    public BigDecimal getTotalRealizedPnl() {
        return totalRealizedPnl;
    }

    private BigDecimal marketPrice(Position position) {
        if (priceProvider == null) {
            return position.getCurrentPrice();
        }
        try {
            BigDecimal latest = priceProvider.getPrice(position.getExchange(), position.getSymbol());
            if (latest != null && latest.signum() > 0) {
                return latest;
            }
            log.debug("No market price for {}, filling at last mark {}", position.key(), position.getCurrentPrice());
        } catch (Exception e) {
            log.warn(
                    "Price lookup failed for {}, filling at last mark {}: {}",
                    position.key(),
                    position.getCurrentPrice(),
                    e.getMessage());
        }
        return position.getCurrentPrice();
    }

    private synchronized void fill(Order order, BigDecimal price) {
        order.setStatus(OrderStatus.CLOSED);
        order.setFilledQuantity(order.getQuantity());
        order.setAveragePrice(price);
        orders.put(order.getId(), order);

        String key = Position.keyOf(order.getExchange(), order.getSymbol());
        Position existing = positions.get(key);
        BigDecimal previous = existing == null ? BigDecimal.ZERO : signed(existing.getSide(), existing.getQuantity());
        BigDecimal change = signed(order.getSide(), order.getQuantity());
        BigDecimal net = previous.add(change);

        BigDecimal entry = existing == null ? price : existing.getEntryPrice();
        BigDecimal realized = existing == null ? BigDecimal.ZERO : existing.getRealizedPnl();

        boolean reducing = previous.signum() != 0 && previous.signum() != change.signum();
        if (reducing) {
            BigDecimal closedQuantity = previous.abs().min(change.abs());
            BigDecimal pnl = price.subtract(entry)
                    .multiply(closedQuantity)
                    .multiply(BigDecimal.valueOf(previous.signum()));
            realized = realized.add(pnl);
            totalRealizedPnl = totalRealizedPnl.add(pnl);
            if (net.signum() != 0 && net.signum() != previous.signum()) {
                entry = price;
            }
        } else if (previous.signum() != 0) {
            BigDecimal notional = entry.multiply(previous.abs()).add(price.multiply(change.abs()));
            entry = notional.divide(net.abs(), MathContext.DECIMAL64);
        }

        if (net.signum() == 0) {
            positions.remove(key);
            log.debug("Paper position closed: {} realized P&L={}", key, realized);
            return;
        }

        Position updated = Position.builder()
                .symbol(order.getSymbol())
                .exchange(order.getExchange())
                .side(net.signum() > 0 ? OrderSide.BUY : OrderSide.SELL)
                .entryPrice(entry)
                .quantity(net.abs())
                .realizedPnl(realized)
                .entryTimestamp(existing != null && !reducing ? existing.getEntryTimestamp() : clock.instant())
                .build()
                .withMarkPrice(price);
        if (existing != null && reducing && net.signum() == previous.signum()) {
            updated.setEntryTimestamp(existing.getEntryTimestamp());
        }
        positions.put(key, updated);
    }

    private static BigDecimal signed(OrderSide side, BigDecimal quantity) {
        return side == OrderSide.SELL ? quantity.negate() : quantity;
    }
}
