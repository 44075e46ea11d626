package org.nowstart.trendband.repository;

import java.util.List;
import org.nowstart.trendband.config.OkxFeignConfig;
import org.nowstart.trendband.data.dto.OkxBalanceResponse;
import org.nowstart.trendband.data.dto.OkxInstrumentResponse;
import org.nowstart.trendband.data.dto.OkxLeverageRequest;
import org.nowstart.trendband.data.dto.OkxOrderAck;
import org.nowstart.trendband.data.dto.OkxOrderDetailResponse;
import org.nowstart.trendband.data.dto.OkxOrderRequest;
import org.nowstart.trendband.data.dto.OkxPositionResponse;
import org.nowstart.trendband.data.dto.OkxResponse;
import org.nowstart.trendband.data.dto.OkxTickerResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "okxClient",
        url = "${trendband.trading.base-url:https://www.okx.com}",
        configuration = OkxFeignConfig.class
)
public interface OkxFeignClient {

    @GetMapping("/api/v5/market/candles")
    OkxResponse<List<String>> getCandles(
            @RequestParam("instId") String instId,
            @RequestParam("bar") String bar,
            @RequestParam(value = "after", required = false) String after,
            @RequestParam("limit") int limit
    );

    @GetMapping("/api/v5/market/ticker")
    OkxResponse<OkxTickerResponse> getTicker(@RequestParam("instId") String instId);

    @GetMapping("/api/v5/public/instruments")
    OkxResponse<OkxInstrumentResponse> getInstruments(
            @RequestParam("instType") String instType,
            @RequestParam("instId") String instId
    );

    @GetMapping("/api/v5/account/balance")
    OkxResponse<OkxBalanceResponse> getBalance(@RequestParam("ccy") String ccy);

    @GetMapping("/api/v5/account/positions")
    OkxResponse<OkxPositionResponse> getPositions(
            @RequestParam("instType") String instType,
            @RequestParam("instId") String instId
    );

    @PostMapping(value = "/api/v5/trade/order", consumes = "application/json")
    OkxResponse<OkxOrderAck> placeOrder(@RequestBody OkxOrderRequest request);

    @GetMapping("/api/v5/trade/order")
    OkxResponse<OkxOrderDetailResponse> getOrder(
            @RequestParam("instId") String instId,
            @RequestParam("ordId") String ordId
    );

    @PostMapping(value = "/api/v5/account/set-leverage", consumes = "application/json")
    OkxResponse<Object> setLeverage(@RequestBody OkxLeverageRequest request);
}
