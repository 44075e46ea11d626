package org.nowstart.trendband.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.nowstart.trendband.accounting.DailyAccounting;
import org.nowstart.trendband.accounting.DailyStats;
import org.nowstart.trendband.data.exception.TradingApiException;
import org.nowstart.trendband.position.TradeStateSnapshot;
import org.nowstart.trendband.service.TradingCycleService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/trading")
@Tag(name = "Trading", description = "Position state and daily statistics of the trading loop")
public class TradingController {

    private final TradingCycleService tradingCycleService;
    private final DailyAccounting dailyAccounting;

    public TradingController(TradingCycleService tradingCycleService, DailyAccounting dailyAccounting) {
        this.tradingCycleService = tradingCycleService;
        this.dailyAccounting = dailyAccounting;
    }

    @GetMapping("/state")
    @Operation(summary = "Trading state", description = "Phase, open position or basket, stop-loss lock and pending exit as of the last cycle.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "State returned")
    })
    public TradeStateSnapshot getState() {
        return tradingCycleService.snapshot();
    }

    @GetMapping("/daily-stats")
    @Operation(summary = "Daily statistics", description = "Trade count, loss streak, halt flag and realized P&L of the current day.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Statistics returned"),
            @ApiResponse(responseCode = "404", description = "No cycle has run yet")
    })
    public DailyStats getDailyStats() {
        return dailyAccounting.current()
                .orElseThrow(() -> TradingApiException.notFound("daily_stats_not_ready", "No trading cycle has run yet"));
    }
}
