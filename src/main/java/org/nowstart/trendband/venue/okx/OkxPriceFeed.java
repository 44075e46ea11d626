package org.nowstart.trendband.venue.okx;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.data.dto.OkxTickerResponse;
import org.nowstart.trendband.data.exception.VenueException;
import org.nowstart.trendband.repository.OkxFeignClient;
import org.nowstart.trendband.strategy.core.OhlcvCandle;
import org.nowstart.trendband.venue.PriceFeed;
import org.springframework.stereotype.Component;

/**
 * OKX public market data. Candles are paged backwards with the {@code after} cursor because one page holds at
 * most {@value #PAGE_LIMIT} bars.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OkxPriceFeed implements PriceFeed {

    static final int PAGE_LIMIT = 300;
    static final int MAX_PAGES = 20;

    private final OkxFeignClient okxFeignClient;

    @Override
    public List<OhlcvCandle> fetchCandles(String symbol, String timeframe, int count) {
        String bar = toBar(timeframe);
        List<OhlcvCandle> newestFirst = new ArrayList<>();
        int closedCount = 0;
        String after = null;

        for (int page = 0; page < MAX_PAGES && closedCount < count; page++) {
            String cursor = after;
            List<List<String>> rows = OkxClientSupport.requireOk(
                    "candles",
                    OkxClientSupport.invoke("candles", () -> okxFeignClient.getCandles(symbol, bar, cursor, PAGE_LIMIT))
            );
            if (rows.isEmpty()) {
                break;
            }
            for (List<String> row : rows) {
                OhlcvCandle candle = toCandle(row);
                if (candle.closed() && closedCount >= count) {
                    continue;
                }
                newestFirst.add(candle);
                if (candle.closed()) {
                    closedCount++;
                }
            }
            after = rows.get(rows.size() - 1).get(0);
            if (rows.size() < PAGE_LIMIT) {
                break;
            }
        }

        Collections.reverse(newestFirst);
        log.debug("event=candles_fetched symbol={} bar={} requested={} closed={}", symbol, bar, count, closedCount);
        return newestFirst;
    }

    @Override
    public double lastPrice(String symbol) {
        List<OkxTickerResponse> tickers = OkxClientSupport.requireOk(
                "ticker",
                OkxClientSupport.invoke("ticker", () -> okxFeignClient.getTicker(symbol))
        );
        double last = tickers.isEmpty() ? Double.NaN : OkxClientSupport.price(tickers.get(0).last());
        if (!Double.isFinite(last) || last <= 0.0) {
            throw VenueException.transientFailure("ticker", "OKX ticker has no last price for " + symbol, null);
        }
        return last;
    }

    static OhlcvCandle toCandle(List<String> row) {
        if (row == null || row.size() < 5) {
            throw VenueException.transientFailure("candles", "malformed OKX candle row: " + row, null);
        }
        boolean closed = row.size() < 9 || "1".equals(row.get(8));
        return new OhlcvCandle(
                Instant.ofEpochMilli(Long.parseLong(row.get(0))),
                Double.parseDouble(row.get(1)),
                Double.parseDouble(row.get(2)),
                Double.parseDouble(row.get(3)),
                Double.parseDouble(row.get(4)),
                row.size() > 5 ? Double.parseDouble(row.get(5)) : 0.0,
                closed
        );
    }

    static String toBar(String timeframe) {
        String trimmed = timeframe.trim();
        char unit = trimmed.charAt(trimmed.length() - 1);
        if (unit == 'h' || unit == 'd' || unit == 'w') {
            return trimmed.substring(0, trimmed.length() - 1) + String.valueOf(unit).toUpperCase(Locale.ROOT);
        }
        return trimmed;
    }
}
