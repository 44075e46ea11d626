package org.nowstart.trendband.indicator;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.nowstart.trendband.strategy.core.OhlcvCandle;

public final class IndicatorFrame {

    private final List<OhlcvCandle> candles;
    private final double[] emaFast;
    private final double[] emaSlow;
    private final double[] emaTrend;
    private final double[] atr;
    private final double[] envelopeUpper;
    private final double[] envelopeLower;
    private final double[] envelopeMid;

    IndicatorFrame(
            List<OhlcvCandle> candles,
            double[] emaFast,
            double[] emaSlow,
            double[] emaTrend,
            double[] atr,
            double[] envelopeUpper,
            double[] envelopeLower,
            double[] envelopeMid
    ) {
        this.candles = List.copyOf(candles);
        this.emaFast = emaFast;
        this.emaSlow = emaSlow;
        this.emaTrend = emaTrend;
        this.atr = atr;
        this.envelopeUpper = envelopeUpper;
        this.envelopeLower = envelopeLower;
        this.envelopeMid = envelopeMid;
    }

    public int size() {
        return candles.size();
    }

    public List<OhlcvCandle> candles() {
        return candles;
    }

    public Optional<IndicatorPoint> point(int index) {
        if (index < 0 || index >= candles.size()) {
            return Optional.empty();
        }
        if (!Double.isFinite(emaFast[index])
                || !Double.isFinite(emaSlow[index])
                || !Double.isFinite(emaTrend[index])
                || !Double.isFinite(atr[index])
                || !Double.isFinite(envelopeUpper[index])
                || !Double.isFinite(envelopeLower[index])
                || !Double.isFinite(envelopeMid[index])) {
            return Optional.empty();
        }

        OhlcvCandle candle = candles.get(index);
        return Optional.of(new IndicatorPoint(
                candle.timestamp(),
                candle.high(),
                candle.low(),
                candle.close(),
                emaFast[index],
                emaSlow[index],
                emaTrend[index],
                atr[index],
                envelopeUpper[index],
                envelopeLower[index],
                envelopeMid[index]
        ));
    }

    public IndicatorPoint latest() {
        return point(size() - 1)
                .orElseThrow(() -> new IllegalStateException("latest closed bar has undefined indicators"));
    }

    public IndicatorPoint previous() {
        return point(size() - 2)
                .orElseThrow(() -> new IllegalStateException("previous closed bar has undefined indicators"));
    }

    public int barsAfter(Instant timestamp) {
        int count = 0;
        for (int i = candles.size() - 1; i >= 0; i--) {
            if (!candles.get(i).timestamp().isAfter(timestamp)) {
                break;
            }
            count++;
        }
        return count;
    }
}
