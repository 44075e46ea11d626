package org.nowstart.trendband.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import org.nowstart.trendband.data.type.StrategyVariant;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "trendband.strategy")
public record StrategyProperties(
        // entry strategy variant used by this deployment
        @NotNull @DefaultValue("ENVELOPE_TOUCH") StrategyVariant variant,
        // fast EMA period
        @Positive @DefaultValue("50") int emaFast,
        // slow EMA period
        @Positive @DefaultValue("100") int emaSlow,
        // long trend EMA period (crossover trend filter, regime slope)
        @Positive @DefaultValue("200") int emaTrend,
        // ATR period
        @Positive @DefaultValue("14") int atrPeriod,
        // kernel bandwidth h of the envelope
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("8.0") BigDecimal envelopeBandwidth,
        // mean absolute error multiplier of the envelope
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("3.0") BigDecimal envelopeMultiplier,
        // envelope window w; needs w+1 closed bars
        @Positive @DefaultValue("500") int envelopeWindow,
        // minimum fast/slow gap (price points) before a trend is declared
        @NotNull @DecimalMin("0") @DefaultValue("0") BigDecimal trendMargin,
        // margin (price points) fast must clear slow by to confirm a cross
        @NotNull @DecimalMin("0") @DefaultValue("0") BigDecimal crossThreshold,
        // crossover entries must agree with the long trend EMA
        @DefaultValue("false") boolean crossTrendFilter,
        // extension distance in ATR multiples for extension-reversion entries
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("1.5") BigDecimal extensionFactor,
        // gate mean-reversion variants with the sideways regime filter
        @DefaultValue("false") boolean regimeFilterEnabled,
        // max |emaFast - emaSlow| / price
        @NotNull @DecimalMin("0") @DefaultValue("0.01") BigDecimal regimeGapCap,
        // min atr / price
        @NotNull @DecimalMin("0") @DefaultValue("0.0005") BigDecimal regimeAtrMinPct,
        // max atr / price
        @NotNull @DecimalMin("0") @DefaultValue("0.02") BigDecimal regimeAtrMaxPct,
        // max |delta emaTrend| / price per bar
        @NotNull @DecimalMin("0") @DefaultValue("0.001") BigDecimal regimeSlopeCap
) {

    public StrategyProperties {
        if (emaFast >= emaSlow) {
            throw new IllegalArgumentException("emaFast must be shorter than emaSlow");
        }
        if (regimeAtrMinPct != null && regimeAtrMaxPct != null && regimeAtrMinPct.compareTo(regimeAtrMaxPct) > 0) {
            throw new IllegalArgumentException("regimeAtrMinPct must not exceed regimeAtrMaxPct");
        }
    }
}
