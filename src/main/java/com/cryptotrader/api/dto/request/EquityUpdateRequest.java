package com.cryptotrader.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Account equity reported by the portfolio side; feeds the drawdown rule. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EquityUpdateRequest {

    @NotNull
    @PositiveOrZero
    private BigDecimal equity;
}
