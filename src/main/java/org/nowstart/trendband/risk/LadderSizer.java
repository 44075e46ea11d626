package org.nowstart.trendband.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.nowstart.trendband.data.property.RiskProperties;
import org.nowstart.trendband.data.property.TradingProperties;
import org.nowstart.trendband.data.type.SizingPolicy;
import org.springframework.stereotype.Component;

@Component
public class LadderSizer implements PositionSizer {

    private final List<RiskProperties.LadderTier> tiers;
    private final TradingProperties tradingProperties;

    public LadderSizer(RiskProperties riskProperties, TradingProperties tradingProperties) {
        this.tiers = riskProperties.ladderTiers().stream()
                .sorted(Comparator.comparing(RiskProperties.LadderTier::minEquity))
                .toList();
        this.tradingProperties = tradingProperties;
    }

    @Override
    public SizingPolicy policy() {
        return SizingPolicy.LADDER;
    }

    public Optional<RiskProperties.LadderTier> tierFor(BigDecimal equity) {
        if (equity == null) {
            return Optional.empty();
        }
        RiskProperties.LadderTier selected = null;
        for (RiskProperties.LadderTier tier : tiers) {
            if (tier.minEquity().compareTo(equity) <= 0) {
                selected = tier;
            }
        }
        return Optional.ofNullable(selected);
    }

    @Override
    public int maxLegs(BigDecimal equity) {
        return tierFor(equity).map(RiskProperties.LadderTier::maxLegs).orElse(0);
    }

    @Override
    public SizingResult size(SizingRequest request) {
        Optional<RiskProperties.LadderTier> tier = tierFor(request.totalEquity());
        if (tier.isEmpty()) {
            return SizingResult.rejected("NO_LADDER_TIER", 0);
        }

        int maxLegs = tier.get().maxLegs();
        if (request.legCount() >= maxLegs) {
            return SizingResult.rejected("MAX_LEGS_REACHED", maxLegs);
        }

        BigDecimal notional = tier.get().legNotional();
        BigDecimal quantity = QuantityRounder.quantityFor(notional, request.entryPrice(), request.metadata());
        if (quantity.signum() <= 0) {
            return new SizingResult(BigDecimal.ZERO, notional, BigDecimal.ZERO, maxLegs, "BELOW_MINIMUM_QUANTITY");
        }
        BigDecimal margin = notional.divide(
                BigDecimal.valueOf(tradingProperties.leverage()),
                QuantityRounder.DIVISION_SCALE,
                RoundingMode.HALF_UP
        );
        return new SizingResult(quantity, notional, margin, maxLegs, "LADDER");
    }
}
