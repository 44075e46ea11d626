package org.nowstart.trendband.service;

import java.math.BigDecimal;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.data.property.PositionProperties;
import org.nowstart.trendband.data.property.TradingProperties;
import org.nowstart.trendband.data.type.PositionSide;
import org.nowstart.trendband.data.type.VenueErrorType;
import org.nowstart.trendband.risk.QuantityRounder;
import org.nowstart.trendband.venue.MarketMetadata;
import org.nowstart.trendband.venue.OrderRequest;
import org.nowstart.trendband.venue.OrderResult;
import org.nowstart.trendband.venue.VenueCallExecutor;
import org.nowstart.trendband.venue.VenueGateway;
import org.nowstart.trendband.venue.VenuePosition;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradingSignalOrderService {

    private final VenueGateway venueGateway;
    private final VenueCallExecutor venueCallExecutor;
    private final PositionProperties positionProperties;
    private final TradingProperties tradingProperties;

    /**
     * Submits an opening order, halving the quantity on insufficient margin until it would fall below the
     * venue minimum.
     */
    public OrderResult submitEntry(OrderRequest request, MarketMetadata metadata) {
        OrderRequest attempt = request;
        while (true) {
            OrderRequest current = attempt;
            OrderResult result = venueCallExecutor.call("order", () -> venueGateway.submitOrder(current));
            if (result.isSuccess() || result.errorType() != VenueErrorType.INSUFFICIENT_MARGIN) {
                return result;
            }

            BigDecimal halved = QuantityRounder.normalize(current.quantity().divide(BigDecimal.valueOf(2)), metadata);
            if (halved.signum() <= 0 || halved.compareTo(current.quantity()) >= 0) {
                log.warn("event=order_margin_exhausted symbol={} side={} last_qty={}", current.symbol(), current.side(), current.quantity());
                return result;
            }
            log.info("event=order_margin_halving symbol={} side={} qty={} next_qty={}", current.symbol(), current.side(), current.quantity(), halved);
            attempt = current.withQuantity(halved);
        }
    }

    public Optional<VenuePosition> confirmEntry(PositionSide side) {
        for (int attempt = 1; attempt <= positionProperties.entryConfirmAttempts(); attempt++) {
            Optional<VenuePosition> position = fetchPosition();
            if (position.isPresent() && position.get().side() == side) {
                return position;
            }
            venueCallExecutor.pause(positionProperties.exitConfirmInterval());
        }
        return Optional.empty();
    }

    public ExitAttempt closePosition(double referencePrice) {
        Optional<VenuePosition> open = fetchPosition();
        if (open.isEmpty()) {
            return ExitAttempt.confirmed(null);
        }

        VenuePosition position = open.get();
        OrderRequest request = OrderRequest.close(tradingProperties.symbol(), position.side(), position.quantity(), referencePrice);
        OrderResult result = venueCallExecutor.call("order", () -> venueGateway.submitOrder(request));
        if (!result.isSuccess()) {
            log.warn(
                    "event=exit_order_failed symbol={} side={} qty={} type={} message={}",
                    request.symbol(),
                    position.side(),
                    position.quantity(),
                    result.errorType(),
                    result.message()
            );
            return ExitAttempt.unconfirmed(result);
        }

        for (int attempt = 1; attempt <= positionProperties.exitConfirmAttempts(); attempt++) {
            venueCallExecutor.pause(positionProperties.exitConfirmInterval());
            if (fetchPosition().isEmpty()) {
                return ExitAttempt.confirmed(result);
            }
        }
        log.warn("event=exit_unconfirmed symbol={} attempts={}", request.symbol(), positionProperties.exitConfirmAttempts());
        return ExitAttempt.unconfirmed(result);
    }

    private Optional<VenuePosition> fetchPosition() {
        return venueCallExecutor.call("position", () -> venueGateway.fetchPosition(tradingProperties.symbol()));
    }
}
