package com.cryptotrader.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cryptotrader.exception.ValidationException;
import com.cryptotrader.risk.config.DrawdownControlConfig;
import com.cryptotrader.risk.config.ExposureLimitConfig;
import com.cryptotrader.risk.config.MaxConcurrentTradesConfig;
import com.cryptotrader.risk.config.RiskConfig;
import com.cryptotrader.risk.config.StopLossConfig;
import com.cryptotrader.risk.config.TakeProfitConfig;
import com.cryptotrader.risk.config.TrailingStopConfig;
import com.cryptotrader.unit.support.RiskFixtures;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Construction-time validation of the risk config records. Every invalid combination
 * must fail with a ValidationException naming the offending field.
 */
class RiskConfigTest {

    @Nested
    @DisplayName("Trailing stop")
    class TrailingStop {

        @Test
        @DisplayName("Activation below trailing percentage is rejected")
        void activationBelowTrailing_rejected() {
            assertThatThrownBy(() -> TrailingStopConfig.builder()
                            .enabled(true)
                            .trailingPercentage(new BigDecimal("5"))
                            .activationPercentage(new BigDecimal("3"))
                            .build())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("activation_percentage");
        }

        @Test
        @DisplayName("Activation equal to trailing percentage is rejected")
        void activationEqualToTrailing_rejected() {
            assertThatThrownBy(() -> TrailingStopConfig.builder()
                            .trailingPercentage(new BigDecimal("3"))
                            .activationPercentage(new BigDecimal("3"))
                            .build())
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Negative cooldown is rejected")
        void negativeCooldown_rejected() {
            assertThatThrownBy(() -> TrailingStopConfig.builder()
                            .trailingPercentage(new BigDecimal("2"))
                            .activationPercentage(new BigDecimal("3"))
                            .cooldownSeconds(-1)
                            .build())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("cooldown_seconds");
        }
    }

    @Nested
    @DisplayName("Exposure and concurrency limits")
    class Limits {

        @Test
        @DisplayName("Per-asset cap above per-exchange cap is rejected")
        void assetAboveExchange_rejected() {
            assertThatThrownBy(() -> ExposureLimitConfig.builder()
                            .maxPerAsset(new BigDecimal("6000"))
                            .maxPerExchange(new BigDecimal("5000"))
                            .maxTotal(new BigDecimal("10000"))
                            .build())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("max_per_asset");
        }

        @Test
        @DisplayName("Per-exchange cap above total cap is rejected")
        void exchangeAboveTotal_rejected() {
            assertThatThrownBy(() -> ExposureLimitConfig.builder()
                            .maxPerAsset(new BigDecimal("1000"))
                            .maxPerExchange(new BigDecimal("20000"))
                            .maxTotal(new BigDecimal("10000"))
                            .build())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("max_per_exchange");
        }

        @Test
        @DisplayName("Base currency defaults to USDT")
        void baseCurrencyDefaults() {
            ExposureLimitConfig config = ExposureLimitConfig.builder()
                    .maxPerAsset(new BigDecimal("1000"))
                    .maxPerExchange(new BigDecimal("1000"))
                    .maxTotal(new BigDecimal("1000"))
                    .build();

            assertThat(config.baseCurrency()).isEqualTo("USDT");
        }

        @Test
        @DisplayName("Per-exchange trade cap above total trade cap is rejected")
        void tradesPerExchangeAboveTotal_rejected() {
            assertThatThrownBy(() -> MaxConcurrentTradesConfig.builder()
                            .maxTrades(3)
                            .maxPerAsset(1)
                            .maxPerExchange(4)
                            .build())
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Drawdown control")
    class Drawdown {

        @Test
        @DisplayName("Emergency threshold must exceed max drawdown when emergency exit is enabled")
        void emergencyNotAboveMax_rejected() {
            assertThatThrownBy(() -> DrawdownControlConfig.builder()
                            .maxDrawdownPercentage(new BigDecimal("20"))
                            .enableEmergencyExit(true)
                            .emergencyExitPercentage(new BigDecimal("15"))
                            .build())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("emergency_exit_percentage");
        }

        @Test
        @DisplayName("Ordering is not enforced when emergency exit is disabled")
        void emergencyDisabled_orderingIgnored() {
            DrawdownControlConfig config = DrawdownControlConfig.builder()
                    .maxDrawdownPercentage(new BigDecimal("20"))
                    .enableEmergencyExit(false)
                    .emergencyExitPercentage(new BigDecimal("15"))
                    .build();

            assertThat(config.calculationPeriodDays()).isEqualTo(30);
        }
    }

    @Nested
    @DisplayName("Stop loss and take profit")
    class StopAndTake {

        @Test
        @DisplayName("Stop loss at or above take profit is rejected when both are enabled")
        void stopAboveTake_rejected() {
            RiskConfig valid = RiskFixtures.defaultConfig();

            assertThatThrownBy(() -> valid.toBuilder()
                            .stopLoss(valid.stopLoss().toBuilder().percentage(new BigDecimal("6")).build())
                            .build())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("stop_loss.percentage");
        }

        @Test
        @DisplayName("Stop loss above take profit is allowed when take profit is disabled")
        void stopAboveDisabledTake_allowed() {
            RiskConfig valid = RiskFixtures.defaultConfig();

            RiskConfig config = valid.toBuilder()
                    .stopLoss(valid.stopLoss().toBuilder().percentage(new BigDecimal("6")).build())
                    .takeProfit(valid.takeProfit().toBuilder().enabled(false).build())
                    .build();

            assertThat(config.stopLoss().percentage()).isEqualByComparingTo("6");
        }

        @Test
        @DisplayName("Partial close without a percentage is rejected")
        void partialCloseWithoutPercentage_rejected() {
            assertThatThrownBy(() -> TakeProfitConfig.builder()
                            .enabled(true)
                            .percentage(new BigDecimal("5"))
                            .partialClose(true)
                            .build())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("partial_close_percentage");
        }

        @Test
        @DisplayName("Stop loss percentage must be inside (0, 100)")
        void stopLossOutOfRange_rejected() {
            assertThatThrownBy(() -> StopLossConfig.builder()
                            .enabled(true)
                            .percentage(new BigDecimal("100"))
                            .build())
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Check interval")
    class CheckInterval {

        @Test
        @DisplayName("Missing interval defaults to one second")
        void missingInterval_defaults() {
            RiskConfig config = RiskFixtures.defaultConfig().toBuilder()
                    .riskCheckInterval(null)
                    .build();

            assertThat(config.riskCheckInterval()).isEqualTo(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("Zero interval is rejected")
        void zeroInterval_rejected() {
            assertThatThrownBy(() -> RiskFixtures.defaultConfig().toBuilder()
                            .riskCheckInterval(Duration.ZERO)
                            .build())
                    .isInstanceOf(ValidationException.class);
        }
    }
}
