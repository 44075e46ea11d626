package org.nowstart.trendband.venue.okx;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.data.dto.OkxInstrumentResponse;
import org.nowstart.trendband.data.exception.VenueException;
import org.nowstart.trendband.repository.OkxFeignClient;
import org.nowstart.trendband.venue.MarketMetadata;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class OkxMarketMetadataProvider {

    static final String INST_TYPE_SWAP = "SWAP";

    private final OkxFeignClient okxFeignClient;
    private final Map<String, MarketMetadata> cache = new ConcurrentHashMap<>();

    public MarketMetadata fetch(String instId) {
        MarketMetadata cached = cache.get(instId);
        if (cached != null) {
            return cached;
        }

        List<OkxInstrumentResponse> instruments = OkxClientSupport.requireOk(
                "instruments",
                OkxClientSupport.invoke("instruments", () -> okxFeignClient.getInstruments(INST_TYPE_SWAP, instId))
        );
        OkxInstrumentResponse instrument = instruments.stream()
                .filter(candidate -> instId.equals(candidate.instId()))
                .findFirst()
                .orElseThrow(() -> VenueException.fatal("instrument", "OKX instrument not found: " + instId));

        BigDecimal contractValue = OkxClientSupport.decimal(instrument.ctVal());
        MarketMetadata metadata = new MarketMetadata(
                OkxClientSupport.decimal(instrument.tickSz()),
                OkxClientSupport.decimal(instrument.lotSz()).multiply(contractValue),
                OkxClientSupport.decimal(instrument.minSz()).multiply(contractValue),
                contractValue
        );
        cache.put(instId, metadata);
        log.info(
                "event=market_metadata instId={} tickSize={} quantityStep={} minQuantity={} contractValue={}",
                instId,
                metadata.tickSize(),
                metadata.quantityStep(),
                metadata.minQuantity(),
                metadata.contractValue()
        );
        return metadata;
    }
}
