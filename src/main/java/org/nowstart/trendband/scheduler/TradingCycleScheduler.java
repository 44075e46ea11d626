package org.nowstart.trendband.scheduler;

import jakarta.annotation.PreDestroy;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.service.TradingCycleService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradingCycleScheduler {

    private final TradingCycleService tradingCycleService;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${trendband.trading.interval:3s}")
    public void run() {
        if (shuttingDown.get()) {
            log.debug("event=cycle_skip reason=SHUTTING_DOWN");
            return;
        }
        tradingCycleService.runOnce();
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown.set(true);
        log.info("event=scheduler_shutdown");
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
}
