package org.nowstart.trendband.risk;

import java.math.BigDecimal;
import lombok.RequiredArgsConstructor;
import org.nowstart.trendband.data.property.RiskProperties;
import org.nowstart.trendband.data.property.TradingProperties;
import org.nowstart.trendband.data.type.SizingPolicy;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MarginFractionSizer implements PositionSizer {

    private final RiskProperties riskProperties;
    private final TradingProperties tradingProperties;

    @Override
    public SizingPolicy policy() {
        return SizingPolicy.MARGIN_FRACTION;
    }

    @Override
    public SizingResult size(SizingRequest request) {
        if (request.freeEquity() == null || request.freeEquity().signum() <= 0) {
            return SizingResult.rejected("NO_FREE_EQUITY", 1);
        }

        BigDecimal margin = request.freeEquity().multiply(riskProperties.marginFraction());
        BigDecimal notional = margin.multiply(BigDecimal.valueOf(tradingProperties.leverage()));
        BigDecimal quantity = QuantityRounder.quantityFor(notional, request.entryPrice(), request.metadata());
        if (quantity.signum() <= 0) {
            return new SizingResult(BigDecimal.ZERO, notional, BigDecimal.ZERO, 1, "BELOW_MINIMUM_QUANTITY");
        }
        return new SizingResult(quantity, notional, margin, 1, "MARGIN_FRACTION");
    }
}
