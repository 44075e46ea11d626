package org.nowstart.trendband.indicator;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.nowstart.trendband.strategy.core.OhlcvCandle;
import org.springframework.stereotype.Component;

@Component
public class IndicatorEngine {

    public Optional<IndicatorFrame> compute(List<OhlcvCandle> closedCandles, IndicatorSettings settings) {
        if (closedCandles == null || closedCandles.size() < settings.requiredBars()) {
            return Optional.empty();
        }
        for (OhlcvCandle candle : closedCandles) {
            if (!candle.closed()) {
                throw new IllegalArgumentException("forming candle at " + candle.timestamp() + " cannot feed indicators");
            }
        }

        int n = closedCandles.size();
        double[] close = new double[n];
        double[] high = new double[n];
        double[] low = new double[n];
        for (int i = 0; i < n; i++) {
            OhlcvCandle candle = closedCandles.get(i);
            close[i] = candle.close();
            high[i] = candle.high();
            low[i] = candle.low();
        }

        double[] upper = fillNaN(n);
        double[] lower = fillNaN(n);
        double[] mid = fillNaN(n);
        for (int i = settings.envelopeWindow(); i < n; i++) {
            Optional<EnvelopeBand> band = envelope(
                    close,
                    i,
                    settings.envelopeBandwidth(),
                    settings.envelopeMultiplier(),
                    settings.envelopeWindow()
            );
            if (band.isPresent()) {
                upper[i] = band.get().upper();
                lower[i] = band.get().lower();
                mid[i] = band.get().mid();
            }
        }

        return Optional.of(new IndicatorFrame(
                closedCandles,
                exponentialMovingAverage(close, settings.emaFast()),
                exponentialMovingAverage(close, settings.emaSlow()),
                exponentialMovingAverage(close, settings.emaTrend()),
                wilderAtr(high, low, close, settings.atrPeriod()),
                upper,
                lower,
                mid
        ));
    }

    public double[] exponentialMovingAverage(double[] values, int length) {
        int n = values.length;
        double[] ema = fillNaN(n);
        if (length <= 0 || n < length) {
            return ema;
        }

        double seed = 0.0;
        for (int i = 0; i < length; i++) {
            seed += values[i];
        }
        ema[length - 1] = seed / length;

        double alpha = 2.0 / (length + 1.0);
        for (int i = length; i < n; i++) {
            ema[i] = (alpha * values[i]) + ((1.0 - alpha) * ema[i - 1]);
        }
        return ema;
    }

    public double[] wilderAtr(double[] high, double[] low, double[] close, int period) {
        int n = close.length;
        double[] atr = fillNaN(n);
        if (period <= 0 || n < period) {
            return atr;
        }

        double[] tr = new double[n];
        tr[0] = high[0] - low[0];
        for (int i = 1; i < n; i++) {
            double highLow = high[i] - low[i];
            double highPrevClose = Math.abs(high[i] - close[i - 1]);
            double lowPrevClose = Math.abs(low[i] - close[i - 1]);
            tr[i] = Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
        }

        double total = 0.0;
        for (int i = 0; i < period; i++) {
            total += tr[i];
        }

        int first = period - 1;
        atr[first] = total / period;
        for (int i = period; i < n; i++) {
            atr[i] = ((atr[i - 1] * (period - 1)) + tr[i]) / period;
        }
        return atr;
    }

    public Optional<EnvelopeBand> envelope(double[] close, int endIndex, double bandwidth, double multiplier, int window) {
        if (window <= 0 || endIndex >= close.length || endIndex < window) {
            return Optional.empty();
        }

        double weighted = 0.0;
        double weightSum = 0.0;
        for (int i = 0; i < window; i++) {
            double weight = gaussian(i, bandwidth);
            weighted += close[endIndex - i] * weight;
            weightSum += weight;
        }
        double mid = weighted / weightSum;

        double deviation = 0.0;
        for (int i = 1; i <= window; i++) {
            deviation += Math.abs(close[endIndex - i] - mid);
        }
        double mae = (deviation / window) * multiplier;
        return Optional.of(new EnvelopeBand(mid + mae, mid - mae, mid));
    }

    private double gaussian(double x, double bandwidth) {
        return Math.exp(-(x * x) / (2.0 * bandwidth * bandwidth));
    }

    private double[] fillNaN(int size) {
        double[] values = new double[size];
        Arrays.fill(values, Double.NaN);
        return values;
    }
}
