package org.nowstart.trendband.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.RequiredArgsConstructor;
import org.nowstart.trendband.data.property.RiskProperties;
import org.nowstart.trendband.data.property.TradingProperties;
import org.nowstart.trendband.data.type.SizingPolicy;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RiskFractionSizer implements PositionSizer {

    private final RiskProperties riskProperties;
    private final TradingProperties tradingProperties;

    @Override
    public SizingPolicy policy() {
        return SizingPolicy.RISK_FRACTION;
    }

    @Override
    public SizingResult size(SizingRequest request) {
        double entry = request.entryPrice();
        if (!Double.isFinite(entry) || entry <= 0.0 || request.freeEquity() == null || request.freeEquity().signum() <= 0) {
            return SizingResult.rejected("NO_EQUITY_OR_PRICE", 1);
        }

        double stopDistanceFraction = Math.abs(entry - request.stopPrice()) / entry;
        if (!Double.isFinite(stopDistanceFraction) || stopDistanceFraction <= 0.0) {
            return SizingResult.rejected("ZERO_STOP_DISTANCE", 1);
        }

        BigDecimal leverage = BigDecimal.valueOf(tradingProperties.leverage());
        BigDecimal notional = request.freeEquity()
                .multiply(riskProperties.riskFraction())
                .divide(BigDecimal.valueOf(stopDistanceFraction), QuantityRounder.DIVISION_SCALE, RoundingMode.DOWN);
        BigDecimal maxNotional = request.freeEquity().multiply(leverage);
        if (notional.compareTo(maxNotional) > 0) {
            notional = maxNotional;
        }

        BigDecimal quantity = QuantityRounder.quantityFor(notional, entry, request.metadata());
        if (quantity.signum() <= 0) {
            return new SizingResult(BigDecimal.ZERO, notional, BigDecimal.ZERO, 1, "BELOW_MINIMUM_QUANTITY");
        }
        BigDecimal margin = notional.divide(leverage, QuantityRounder.DIVISION_SCALE, RoundingMode.HALF_UP);
        return new SizingResult(quantity, notional, margin, 1, "RISK_FRACTION");
    }
}
