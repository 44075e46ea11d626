package org.nowstart.trendband.venue.okx;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.data.dto.OkxBalanceResponse;
import org.nowstart.trendband.data.dto.OkxLeverageRequest;
import org.nowstart.trendband.data.dto.OkxOrderAck;
import org.nowstart.trendband.data.dto.OkxOrderDetailResponse;
import org.nowstart.trendband.data.dto.OkxOrderRequest;
import org.nowstart.trendband.data.dto.OkxPositionResponse;
import org.nowstart.trendband.data.dto.OkxResponse;
import org.nowstart.trendband.data.exception.VenueException;
import org.nowstart.trendband.data.property.TradingProperties;
import org.nowstart.trendband.data.type.MarginMode;
import org.nowstart.trendband.data.type.PositionSide;
import org.nowstart.trendband.data.type.VenueErrorType;
import org.nowstart.trendband.repository.OkxFeignClient;
import org.nowstart.trendband.venue.EquitySnapshot;
import org.nowstart.trendband.venue.MarketMetadata;
import org.nowstart.trendband.venue.OrderRequest;
import org.nowstart.trendband.venue.OrderResult;
import org.nowstart.trendband.venue.VenueGateway;
import org.nowstart.trendband.venue.VenuePosition;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(name = "trendband.trading.execution-mode", havingValue = "LIVE", matchIfMissing = true)
public class OkxVenueGateway implements VenueGateway {

    private static final String ORDER_TYPE_MARKET = "market";
    private static final String STATE_FILLED = "filled";

    private final OkxFeignClient okxFeignClient;
    private final OkxMarketMetadataProvider okxMarketMetadataProvider;
    private final TradingProperties tradingProperties;

    public OkxVenueGateway(
            OkxFeignClient okxFeignClient,
            OkxMarketMetadataProvider okxMarketMetadataProvider,
            TradingProperties tradingProperties
    ) {
        this.okxFeignClient = okxFeignClient;
        this.okxMarketMetadataProvider = okxMarketMetadataProvider;
        this.tradingProperties = tradingProperties;
    }

    @Override
    public Optional<VenuePosition> fetchPosition(String symbol) {
        List<OkxPositionResponse> positions = OkxClientSupport.requireOk(
                "positions",
                OkxClientSupport.invoke(
                        "positions",
                        () -> okxFeignClient.getPositions(OkxMarketMetadataProvider.INST_TYPE_SWAP, symbol)
                )
        );
        BigDecimal contractValue = fetchMarketMetadata(symbol).contractValue();

        for (OkxPositionResponse position : positions) {
            if (!symbol.equals(position.instId())) {
                continue;
            }
            BigDecimal contracts = OkxClientSupport.decimal(position.pos());
            if (contracts.signum() == 0) {
                continue;
            }
            PositionSide side = resolveSide(position.posSide(), contracts);
            return Optional.of(new VenuePosition(
                    side,
                    contracts.abs().multiply(contractValue),
                    OkxClientSupport.price(position.avgPx()),
                    OkxClientSupport.decimal(position.upl())
            ));
        }
        return Optional.empty();
    }

    @Override
    public MarketMetadata fetchMarketMetadata(String symbol) {
        return okxMarketMetadataProvider.fetch(symbol);
    }

    @Override
    public OrderResult submitOrder(OrderRequest request) {
        MarketMetadata metadata = fetchMarketMetadata(request.symbol());
        BigDecimal contracts = request.quantity()
                .divide(metadata.contractValue(), 8, RoundingMode.DOWN)
                .stripTrailingZeros();
        if (contracts.signum() <= 0) {
            return OrderResult.failed(VenueErrorType.BELOW_MINIMUM, "quantity converts to zero contracts");
        }

        boolean hedgeMode = tradingProperties.hedgeMode();
        OkxOrderRequest body = new OkxOrderRequest(
                request.symbol(),
                tradingProperties.marginMode().venueValue(),
                request.side().venueValue(),
                hedgeMode ? request.positionSide().venueValue() : null,
                ORDER_TYPE_MARKET,
                contracts.toPlainString(),
                !hedgeMode && request.reduceOnly() ? Boolean.TRUE : null
        );

        OkxResponse<OkxOrderAck> response = OkxClientSupport.invoke("order", () -> okxFeignClient.placeOrder(body));
        if (response == null) {
            return OrderResult.failed(VenueErrorType.TRANSIENT, "OKX order returned no body");
        }
        OkxOrderAck ack = response.dataOrEmpty().isEmpty() ? null : response.dataOrEmpty().get(0);
        if (!response.isOk() || ack == null || (ack.sCode() != null && !"0".equals(ack.sCode()))) {
            String code = ack != null && ack.sCode() != null && !"0".equals(ack.sCode()) ? ack.sCode() : response.code();
            String message = ack != null && ack.sMsg() != null && !ack.sMsg().isBlank() ? ack.sMsg() : response.msg();
            log.warn("event=okx_order_rejected instId={} side={} sz={} code={} message={}", request.symbol(), request.side(), body.sz(), code, message);
            return OrderResult.failed(OkxErrorCodes.classify(code), "code=" + code + " " + message);
        }

        log.info(
                "event=okx_order_placed instId={} side={} posSide={} sz={} reduceOnly={} ordId={}",
                request.symbol(),
                request.side(),
                body.posSide(),
                body.sz(),
                request.reduceOnly(),
                ack.ordId()
        );
        return resolveFill(request, ack.ordId(), metadata);
    }

    private OrderResult resolveFill(OrderRequest request, String ordId, MarketMetadata metadata) {
        try {
            List<OkxOrderDetailResponse> details = OkxClientSupport.requireOk(
                    "order-detail",
                    OkxClientSupport.invoke("order-detail", () -> okxFeignClient.getOrder(request.symbol(), ordId))
            );
            if (!details.isEmpty() && STATE_FILLED.equals(details.get(0).state())) {
                OkxOrderDetailResponse detail = details.get(0);
                BigDecimal filled = OkxClientSupport.decimal(detail.accFillSz()).multiply(metadata.contractValue());
                return OrderResult.filled(ordId, filled, OkxClientSupport.price(detail.avgPx()));
            }
        } catch (VenueException e) {
            log.warn("event=okx_order_detail_failed ordId={} type={} message={}", ordId, e.getType(), e.getMessage());
        }
        return OrderResult.accepted(ordId, request.quantity());
    }

    @Override
    public EquitySnapshot fetchEquity() {
        String currency = tradingProperties.quoteCurrency();
        List<OkxBalanceResponse> balances = OkxClientSupport.requireOk(
                "balance",
                OkxClientSupport.invoke("balance", () -> okxFeignClient.getBalance(currency))
        );
        if (balances.isEmpty()) {
            return new EquitySnapshot(BigDecimal.ZERO, BigDecimal.ZERO);
        }

        OkxBalanceResponse balance = balances.get(0);
        if (balance.details() != null) {
            for (OkxBalanceResponse.Detail detail : balance.details()) {
                if (!currency.equals(detail.ccy())) {
                    continue;
                }
                BigDecimal free = OkxClientSupport.decimal(detail.availBal())
                        .subtract(OkxClientSupport.decimal(detail.ordFrozen()))
                        .max(BigDecimal.ZERO);
                return new EquitySnapshot(free, OkxClientSupport.decimal(detail.eq()));
            }
        }
        return new EquitySnapshot(BigDecimal.ZERO, OkxClientSupport.decimal(balance.totalEq()));
    }

    @Override
    public void configureLeverage(String symbol, int leverage, MarginMode marginMode) {
        OkxLeverageRequest body = new OkxLeverageRequest(symbol, String.valueOf(leverage), marginMode.venueValue());
        OkxClientSupport.requireOk("set-leverage", OkxClientSupport.invoke("set-leverage", () -> okxFeignClient.setLeverage(body)));
        log.info("event=leverage_configured instId={} leverage={} marginMode={}", symbol, leverage, marginMode);
    }

    private PositionSide resolveSide(String posSide, BigDecimal contracts) {
        if ("long".equals(posSide)) {
            return PositionSide.LONG;
        }
        if ("short".equals(posSide)) {
            return PositionSide.SHORT;
        }
        return contracts.signum() > 0 ? PositionSide.LONG : PositionSide.SHORT;
    }
}
