package org.nowstart.trendband.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import org.nowstart.trendband.data.type.ExecutionMode;
import org.nowstart.trendband.data.type.MarginMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "trendband.trading")
public record TradingProperties(
        // OKX REST API base URL
        @NotBlank @DefaultValue("https://www.okx.com") String baseUrl,
        // OKX API key
        @DefaultValue("") String apiKey,
        // OKX secret used for HMAC request signing
        @DefaultValue("") String secretKey,
        // OKX API passphrase
        @DefaultValue("") String passphrase,
        // traded perpetual swap instrument id
        @NotBlank @DefaultValue("BTC-USDT-SWAP") String symbol,
        // quote currency equity is denominated in
        @NotBlank @DefaultValue("USDT") String quoteCurrency,
        // candle timeframe fed to the indicators
        @NotBlank @DefaultValue("15m") String timeframe,
        // idle interval between two decision cycles
        @NotNull @DefaultValue("3s") Duration interval,
        // order execution mode (LIVE or PAPER)
        @NotNull @DefaultValue("LIVE") ExecutionMode executionMode,
        // closed candles to request; 0 derives the count from the active strategy warmup
        @DefaultValue("0") int candleCount,
        // leverage applied to the instrument
        @Positive @DefaultValue("15") int leverage,
        // isolated or cross margin
        @NotNull @DefaultValue("ISOLATED") MarginMode marginMode,
        // send posSide with orders (long/short position mode)
        @DefaultValue("true") boolean hedgeMode,
        // PAPER mode starting equity in quote currency
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("1000") BigDecimal paperInitialEquity,
        // PAPER mode fee rate per fill (0.0005 = 0.05%)
        @DecimalMin("0") @DefaultValue("0.0005") BigDecimal paperFeeRate
) {

    public boolean hasCredentials() {
        return !apiKey.isBlank() && !secretKey.isBlank() && !passphrase.isBlank();
    }
}
