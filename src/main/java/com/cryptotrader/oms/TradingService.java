package com.cryptotrader.oms;

import com.cryptotrader.domain.model.Order;
import java.util.List;
import java.util.Optional;

/** Order placement on an exchange account. Used by the execution pipeline. */
public interface TradingService {

    /**
     * Places an order and returns it as acknowledged by the venue.
     *
     * @throws com.cryptotrader.exception.ValidationException if the request is malformed
     * @throws com.cryptotrader.exception.TradingException if the venue refuses or fails the order
     */
    Order createOrder(OrderRequest request);

    Order cancelOrder(String exchange, String orderId);

    Optional<Order> getOrder(String exchange, String orderId);

    List<Order> getOpenOrders(String exchange, String symbol);
}
