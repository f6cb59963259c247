package com.cryptotrader.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cryptotrader.domain.enums.OrderSide;
import com.cryptotrader.domain.enums.OrderStatus;
import com.cryptotrader.domain.enums.OrderType;
import com.cryptotrader.domain.model.Order;
import com.cryptotrader.domain.model.Position;
import com.cryptotrader.exception.ErrorCode;
import com.cryptotrader.exception.ResourceNotFoundException;
import com.cryptotrader.exception.TradingException;
import com.cryptotrader.exception.ValidationException;
import com.cryptotrader.exchange.LatestPriceBook;
import com.cryptotrader.oms.OrderRequest;
import com.cryptotrader.simulator.PaperTradingService;
import com.cryptotrader.unit.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PaperTradingServiceTest {

    private MutableClock clock;
    private PaperTradingService paper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        paper = new PaperTradingService(clock);
    }

    // ==============================
    // ORDERS
    // ==============================

    @Nested
    @DisplayName("Orders")
    class Orders {

        @Test
        @DisplayName("MARKET order fills at the reference price and opens a position")
        void marketFill() {
            Order order = paper.createOrder(market(OrderSide.BUY, "0.5", "50000"));

            assertThat(order.getStatus()).isEqualTo(OrderStatus.CLOSED);
            assertThat(order.getFilledQuantity()).isEqualByComparingTo("0.5");
            assertThat(order.getAveragePrice()).isEqualByComparingTo("50000");

            List<Position> positions = paper.fetchPositions();
            assertThat(positions).hasSize(1);
            assertThat(positions.get(0).getSide()).isEqualTo(OrderSide.BUY);
            assertThat(positions.get(0).getValue()).isEqualByComparingTo("25000");
        }

        @Test
        @DisplayName("LIMIT order stays open until cancelled")
        void limitOpenThenCancel() {
            OrderRequest request = OrderRequest.builder()
                    .exchange("binance")
                    .symbol("BTC/USDT")
                    .side(OrderSide.BUY)
                    .type(OrderType.LIMIT)
                    .quantity(new BigDecimal("1"))
                    .price(new BigDecimal("45000"))
                    .build();

            Order order = paper.createOrder(request);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.OPEN);
            assertThat(paper.getOpenOrders("binance", null)).hasSize(1);

            paper.cancelOrder("binance", order.getId());

            assertThat(paper.getOrder("binance", order.getId())).get()
                    .extracting(Order::getStatus)
                    .isEqualTo(OrderStatus.CANCELED);
            assertThat(paper.fetchPositions()).isEmpty();
            assertThatThrownBy(() -> paper.cancelOrder("binance", order.getId()))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("MARKET order without a reference price fails")
        void marketWithoutReference() {
            assertThatThrownBy(() -> paper.createOrder(market(OrderSide.BUY, "1", null)))
                    .isInstanceOf(TradingException.class);
        }

        @Test
        @DisplayName("Unknown orders are not found")
        void unknownOrder() {
            assertThatThrownBy(() -> paper.cancelOrder("binance", "nope"))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .extracting(e -> ((ResourceNotFoundException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ORDER_NOT_FOUND);
            assertThat(paper.getOrder("binance", "nope")).isEmpty();
        }
    }

    // ==============================
    // POSITIONS
    // ==============================

    @Nested
    @DisplayName("Position netting")
    class Netting {

        @Test
        @DisplayName("Adding to a position averages the entry price")
        void averageEntry() {
            paper.createOrder(market(OrderSide.BUY, "1", "100"));
            paper.createOrder(market(OrderSide.BUY, "1", "110"));

            Position position = paper.fetchPositions().get(0);
            assertThat(position.getQuantity()).isEqualByComparingTo("2");
            assertThat(position.getEntryPrice()).isEqualByComparingTo("105");
        }

        @Test
        @DisplayName("Selling the whole position closes it and realizes P&L")
        void closeRealizes() {
            paper.createOrder(market(OrderSide.BUY, "2", "100"));
            paper.createOrder(market(OrderSide.SELL, "2", "120"));

            assertThat(paper.fetchPositions()).isEmpty();
            assertThat(paper.getTotalRealizedPnl()).isEqualByComparingTo("40");
        }

        @Test
        @DisplayName("Selling through zero flips to a short at the fill price")
        void flipToShort() {
            paper.createOrder(market(OrderSide.BUY, "1", "100"));
            paper.createOrder(market(OrderSide.SELL, "3", "90"));

            Position position = paper.fetchPositions().get(0);
            assertThat(position.getSide()).isEqualTo(OrderSide.SELL);
            assertThat(position.getQuantity()).isEqualByComparingTo("2");
            assertThat(position.getEntryPrice()).isEqualByComparingTo("90");
            assertThat(paper.getTotalRealizedPnl()).isEqualByComparingTo("-10");
        }
    }

    // ==============================
    // RISK ACTIONS
    // ==============================

    @Nested
    @DisplayName("Risk actions")
    class RiskActions {

        @Test
        @DisplayName("Partial close sells the requested share of the position")
        void partialClose() {
            paper.createOrder(market(OrderSide.BUY, "2", "100"));

            Order order = paper.partialClosePosition("binance", "BTC/USDT", new BigDecimal("25"), "take_profit", "e1");

            assertThat(order.getSide()).isEqualTo(OrderSide.SELL);
            assertThat(order.getQuantity()).isEqualByComparingTo("0.5");
            assertThat(paper.fetchPositions().get(0).getQuantity()).isEqualByComparingTo("1.5");
        }

        @Test
        @DisplayName("Risk closes fill at the latest market price, not the entry mark")
        void partialClose_fillsAtLatestPrice() {
            LatestPriceBook priceBook = new LatestPriceBook();
            PaperTradingService marked = new PaperTradingService(clock, priceBook);
            marked.createOrder(market(OrderSide.BUY, "1", "100"));
            priceBook.record("binance", "BTC/USDT", new BigDecimal("120"));

            Order order = marked.partialClosePosition("binance", "BTC/USDT", new BigDecimal("50"), "take_profit", "e6");

            assertThat(order.getAveragePrice()).isEqualByComparingTo("120");
            assertThat(marked.getTotalRealizedPnl()).isEqualByComparingTo("10");
            assertThat(marked.fetchPositions().get(0).getQuantity()).isEqualByComparingTo("0.5");
        }

        @Test
        @DisplayName("Without a known market price the close fills at the position's last mark")
        void partialClose_fallsBackToMark() {
            PaperTradingService marked = new PaperTradingService(clock, new LatestPriceBook());
            marked.createOrder(market(OrderSide.BUY, "1", "100"));

            Order order = marked.closePosition("binance", "BTC/USDT", "stop_loss", "e7");

            assertThat(order.getAveragePrice()).isEqualByComparingTo("100");
            assertThat(marked.fetchPositions()).isEmpty();
        }

        @Test
        @DisplayName("A failing price source falls back to the last mark")
        void partialClose_priceSourceFails() {
            PaperTradingService marked = new PaperTradingService(clock, (exchange, symbol) -> {
                throw new IllegalStateException("feed down");
            });
            marked.createOrder(market(OrderSide.SELL, "2", "100"));

            Order order = marked.partialClosePosition("binance", "BTC/USDT", new BigDecimal("50"), "take_profit", "e8");

            assertThat(order.getSide()).isEqualTo(OrderSide.BUY);
            assertThat(order.getAveragePrice()).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("Close all flattens every position")
        void closeAll() {
            paper.createOrder(market(OrderSide.BUY, "1", "100"));
            paper.createOrder(OrderRequest.builder()
                    .exchange("binance")
                    .symbol("ETH/USDT")
                    .side(OrderSide.SELL)
                    .quantity(BigDecimal.ONE)
                    .referencePrice(new BigDecimal("3000"))
                    .build());

            List<Order> closing = paper.closeAllPositions("drawdown", "e2");

            assertThat(closing).hasSize(2);
            assertThat(paper.fetchPositions()).isEmpty();
        }

        @Test
        @DisplayName("Closing an unknown position or an invalid share fails")
        void invalidClose() {
            assertThatThrownBy(() -> paper.closePosition("binance", "BTC/USDT", "stop_loss", "e3"))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .extracting(e -> ((ResourceNotFoundException) e).getErrorCode())
                    .isEqualTo(ErrorCode.POSITION_NOT_FOUND);
            assertThatThrownBy(() -> paper.partialClosePosition("binance", "BTC/USDT", BigDecimal.ZERO, "x", "e4"))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Blocked trading rejects orders until the block expires")
        void blockExpires() {
            paper.blockNewTrades(Duration.ofMinutes(10), "drawdown", "e5");

            assertThat(paper.createOrder(market(OrderSide.BUY, "1", "100")).getStatus())
                    .isEqualTo(OrderStatus.REJECTED);

            clock.advance(Duration.ofMinutes(10));
            assertThat(paper.isTradingBlocked()).isFalse();
            assertThat(paper.createOrder(market(OrderSide.BUY, "1", "100")).getStatus())
                    .isEqualTo(OrderStatus.CLOSED);
        }

        @Test
        @DisplayName("An indefinite block lasts until resumed")
        void indefiniteBlock() {
            paper.blockNewTrades(null, "drawdown", "e6");
            clock.advance(Duration.ofDays(365));
            assertThat(paper.isTradingBlocked()).isTrue();

            paper.resumeTrading("manual");

            assertThat(paper.isTradingBlocked()).isFalse();
        }
    }

    private static OrderRequest market(OrderSide side, String quantity, String referencePrice) {
        return OrderRequest.builder()
                .exchange("binance")
                .symbol("BTC/USDT")
                .side(side)
                .type(OrderType.MARKET)
                .quantity(new BigDecimal(quantity))
                .referencePrice(referencePrice == null ? null : new BigDecimal(referencePrice))
                .build();
    }
}
