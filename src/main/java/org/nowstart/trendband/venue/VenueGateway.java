package org.nowstart.trendband.venue;

import java.util.Optional;
import org.nowstart.trendband.data.type.MarginMode;

/**
 * Account-side venue operations. Implementations throw {@link org.nowstart.trendband.data.exception.VenueException}
 * for transport failures and report order rejections through {@link OrderResult}.
 */
public interface VenueGateway {

    Optional<VenuePosition> fetchPosition(String symbol);

    MarketMetadata fetchMarketMetadata(String symbol);

    OrderResult submitOrder(OrderRequest request);

    EquitySnapshot fetchEquity();

    void configureLeverage(String symbol, int leverage, MarginMode marginMode);
}
