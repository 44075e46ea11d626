package org.nowstart.trendband.risk;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.nowstart.trendband.data.property.RiskProperties;
import org.nowstart.trendband.data.type.SizingPolicy;
import org.springframework.stereotype.Service;

@Service
public class RiskSizer {

    private final Map<SizingPolicy, PositionSizer> sizersByPolicy;
    private final RiskProperties riskProperties;

    public RiskSizer(List<PositionSizer> sizers, RiskProperties riskProperties) {
        Map<SizingPolicy, PositionSizer> byPolicy = new EnumMap<>(SizingPolicy.class);
        for (PositionSizer sizer : sizers) {
            if (byPolicy.put(sizer.policy(), sizer) != null) {
                throw new IllegalStateException("Duplicate sizer registered for policy=" + sizer.policy());
            }
        }
        this.sizersByPolicy = Map.copyOf(byPolicy);
        this.riskProperties = riskProperties;
    }

    public SizingPolicy activePolicy() {
        return riskProperties.sizingPolicy();
    }

    public boolean usesBaskets() {
        return activePolicy() == SizingPolicy.LADDER;
    }

    public SizingResult size(SizingRequest request) {
        return activeSizer().size(request);
    }

    public int maxLegs(BigDecimal totalEquity) {
        return activeSizer().maxLegs(totalEquity);
    }

    private PositionSizer activeSizer() {
        PositionSizer sizer = sizersByPolicy.get(activePolicy());
        if (sizer == null) {
            throw new IllegalStateException("No sizer registered for policy=" + activePolicy());
        }
        return sizer;
    }
}
