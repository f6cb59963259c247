package com.cryptotrader.unit.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cryptotrader.config.RiskProperties;
import com.cryptotrader.exception.ValidationException;
import com.cryptotrader.risk.config.RiskConfig;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RiskPropertiesTest {

    @Test
    @DisplayName("Defaults convert into a valid risk config")
    void defaultsConvert() {
        RiskConfig config = new RiskProperties().toRiskConfig();

        assertThat(config.stopLoss().percentage()).isEqualByComparingTo("2.0");
        assertThat(config.takeProfit().percentage()).isEqualByComparingTo("5.0");
        assertThat(config.exposureLimits().maxTotal()).isEqualByComparingTo("10000");
        assertThat(config.trailingStop().enabled()).isFalse();
        assertThat(config.maxConcurrentTrades().maxTrades()).isEqualTo(5);
        assertThat(config.drawdownControl().emergencyExitPercentage()).isEqualByComparingTo("25.0");
        assertThat(config.riskCheckInterval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.emergencyOnlyMode()).isFalse();
    }

    @Test
    @DisplayName("Stop loss at or above take profit is rejected")
    void stopLossAboveTakeProfit() {
        RiskProperties properties = new RiskProperties();
        properties.getStopLoss().setPercentage(new BigDecimal("6"));

        assertThatThrownBy(properties::toRiskConfig)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("stop_loss.percentage");
    }

    @Test
    @DisplayName("Trailing activation must exceed the trailing distance")
    void trailingActivationTooLow() {
        RiskProperties properties = new RiskProperties();
        properties.getTrailingStop().setActivationPercentage(new BigDecimal("1.5"));

        assertThatThrownBy(properties::toRiskConfig)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("activation_percentage");
    }

    @Test
    @DisplayName("A non-positive check interval is rejected")
    void zeroInterval() {
        RiskProperties properties = new RiskProperties();
        properties.setCheckInterval(Duration.ZERO);

        assertThatThrownBy(properties::toRiskConfig).isInstanceOf(ValidationException.class);
    }
}
