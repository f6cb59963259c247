package com.cryptotrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A proposed trade to run through the new-trade admission rules. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckTradeRequest {

    /** Trading pair, e.g. "BTC/USDT". */
    @NotBlank
    private String symbol;

    @NotBlank
    private String exchange;

    /** Notional value of the trade in the base currency. */
    @NotNull
    @Positive
    private BigDecimal value;
}
