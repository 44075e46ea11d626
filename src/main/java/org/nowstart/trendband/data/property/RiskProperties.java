package org.nowstart.trendband.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.util.List;
import org.nowstart.trendband.data.type.SizingPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "trendband.risk")
public record RiskProperties(
        // sizing policy used by this deployment
        @NotNull @DefaultValue("MARGIN_FRACTION") SizingPolicy sizingPolicy,
        // share of equity risked per trade (RISK_FRACTION)
        @NotNull @DecimalMin(value = "0", inclusive = false) @DecimalMax("1") @DefaultValue("0.01") BigDecimal riskFraction,
        // share of free equity committed as margin (MARGIN_FRACTION)
        @NotNull @DecimalMin(value = "0", inclusive = false) @DecimalMax("1") @DefaultValue("0.80") BigDecimal marginFraction,
        // capital tiers (LADDER), any order; sorted by minEquity when used
        @Valid List<LadderTier> ladderTiers,
        // basket closes when equity grows by this fraction of equity at open
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.02") BigDecimal basketTargetFraction,
        // basket closes when equity falls by this fraction of equity at open
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.03") BigDecimal basketStopFraction
) {

    public RiskProperties {
        ladderTiers = ladderTiers == null ? List.of() : List.copyOf(ladderTiers);
    }

    public record LadderTier(
            @NotNull @DecimalMin("0") BigDecimal minEquity,
            @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal legNotional,
            @Positive int maxLegs
    ) {
    }
}
