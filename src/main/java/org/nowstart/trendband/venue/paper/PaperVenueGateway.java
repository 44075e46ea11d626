package org.nowstart.trendband.venue.paper;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.data.property.TradingProperties;
import org.nowstart.trendband.data.type.MarginMode;
import org.nowstart.trendband.data.type.PositionSide;
import org.nowstart.trendband.data.type.VenueErrorType;
import org.nowstart.trendband.venue.EquitySnapshot;
import org.nowstart.trendband.venue.MarketMetadata;
import org.nowstart.trendband.venue.OrderRequest;
import org.nowstart.trendband.venue.OrderResult;
import org.nowstart.trendband.venue.PriceFeed;
import org.nowstart.trendband.venue.VenueGateway;
import org.nowstart.trendband.venue.VenuePosition;
import org.nowstart.trendband.venue.okx.OkxMarketMetadataProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(name = "trendband.trading.execution-mode", havingValue = "PAPER")
public class PaperVenueGateway implements VenueGateway {

    private static final int SCALE = 12;

    private final PriceFeed priceFeed;
    private final OkxMarketMetadataProvider okxMarketMetadataProvider;
    private final String symbol;
    private final BigDecimal feeRate;
    private final AtomicLong orderSequence = new AtomicLong();
    private BigDecimal cash;
    private int leverage;
    private PositionSide side;
    private BigDecimal quantity = BigDecimal.ZERO;
    private double entryPrice;

    public PaperVenueGateway(
            PriceFeed priceFeed,
            OkxMarketMetadataProvider okxMarketMetadataProvider,
            TradingProperties tradingProperties
    ) {
        this.priceFeed = priceFeed;
        this.okxMarketMetadataProvider = okxMarketMetadataProvider;
        this.symbol = tradingProperties.symbol();
        this.feeRate = tradingProperties.paperFeeRate();
        this.cash = tradingProperties.paperInitialEquity();
        this.leverage = tradingProperties.leverage();
    }

    @Override
    public Optional<VenuePosition> fetchPosition(String symbol) {
        if (side == null) {
            return Optional.empty();
        }
        return Optional.of(new VenuePosition(side, quantity, entryPrice, unrealizedPnl(priceFeed.lastPrice(symbol))));
    }

    @Override
    public MarketMetadata fetchMarketMetadata(String symbol) {
        return okxMarketMetadataProvider.fetch(symbol);
    }

    @Override
    public OrderResult submitOrder(OrderRequest request) {
        double price = request.referencePrice();
        BigDecimal requested = request.quantity();
        if (requested == null || requested.signum() <= 0 || !Double.isFinite(price) || price <= 0.0) {
            return OrderResult.failed(VenueErrorType.REJECTED, "invalid paper order " + request);
        }
        MarketMetadata metadata = fetchMarketMetadata(request.symbol());
        if (requested.compareTo(metadata.minQuantity()) < 0) {
            return OrderResult.failed(VenueErrorType.BELOW_MINIMUM, "quantity below minimum " + metadata.minQuantity());
        }
        return request.reduceOnly() ? close(request, price) : open(request, price);
    }

    private OrderResult open(OrderRequest request, double price) {
        if (side != null && side != request.positionSide()) {
            return OrderResult.failed(VenueErrorType.REJECTED, "opposite position is open");
        }

        BigDecimal notional = request.quantity().multiply(BigDecimal.valueOf(price));
        BigDecimal fee = notional.multiply(feeRate);
        BigDecimal margin = notional.divide(BigDecimal.valueOf(leverage), SCALE, RoundingMode.HALF_UP);
        BigDecimal free = fetchEquity(price).free();
        if (margin.add(fee).compareTo(free) > 0) {
            return OrderResult.failed(VenueErrorType.INSUFFICIENT_MARGIN, "margin " + margin + " exceeds free " + free);
        }

        BigDecimal total = quantity.add(request.quantity());
        entryPrice = BigDecimal.valueOf(entryPrice).multiply(quantity)
                .add(BigDecimal.valueOf(price).multiply(request.quantity()))
                .divide(total, SCALE, RoundingMode.HALF_UP)
                .doubleValue();
        quantity = total;
        side = request.positionSide();
        cash = cash.subtract(fee);
        return fill(request, price, fee);
    }

    private OrderResult close(OrderRequest request, double price) {
        if (side == null || side != request.positionSide()) {
            return OrderResult.failed(VenueErrorType.REJECTED, "no " + request.positionSide() + " position to reduce");
        }

        BigDecimal closing = request.quantity().min(quantity);
        BigDecimal pnl = BigDecimal.valueOf(side.sign() * (price - entryPrice)).multiply(closing);
        BigDecimal fee = closing.multiply(BigDecimal.valueOf(price)).multiply(feeRate);
        cash = cash.add(pnl).subtract(fee);
        quantity = quantity.subtract(closing);
        if (quantity.signum() == 0) {
            side = null;
            entryPrice = 0.0;
        }
        return fill(request.withQuantity(closing), price, fee);
    }

    private OrderResult fill(OrderRequest request, double price, BigDecimal fee) {
        String orderId = "paper-" + orderSequence.incrementAndGet();
        log.info(
                "event=paper_fill orderId={} side={} positionSide={} qty={} price={} fee={} cash={}",
                orderId,
                request.side(),
                request.positionSide(),
                request.quantity(),
                price,
                fee,
                cash
        );
        return OrderResult.filled(orderId, request.quantity(), price);
    }

    @Override
    public EquitySnapshot fetchEquity() {
        return fetchEquity(side == null ? Double.NaN : priceFeed.lastPrice(symbol));
    }

    private EquitySnapshot fetchEquity(double markPrice) {
        BigDecimal unrealized = side == null ? BigDecimal.ZERO : unrealizedPnl(markPrice);
        BigDecimal total = cash.add(unrealized);
        BigDecimal usedMargin = side == null
                ? BigDecimal.ZERO
                : BigDecimal.valueOf(entryPrice).multiply(quantity).divide(BigDecimal.valueOf(leverage), SCALE, RoundingMode.HALF_UP);
        return new EquitySnapshot(total.subtract(usedMargin).max(BigDecimal.ZERO), total);
    }

    private BigDecimal unrealizedPnl(double markPrice) {
        if (side == null || !Double.isFinite(markPrice)) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(side.sign() * (markPrice - entryPrice)).multiply(quantity);
    }

    @Override
    public void configureLeverage(String symbol, int leverage, MarginMode marginMode) {
        this.leverage = leverage;
        log.info("event=paper_leverage symbol={} leverage={} marginMode={}", symbol, leverage, marginMode);
    }
}
