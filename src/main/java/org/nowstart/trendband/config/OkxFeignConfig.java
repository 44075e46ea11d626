package org.nowstart.trendband.config;

import feign.RequestInterceptor;
import feign.codec.ErrorDecoder;
import java.time.Clock;
import org.nowstart.trendband.data.property.TradingProperties;
import org.nowstart.trendband.service.auth.OkxAuthRequestInterceptor;
import org.nowstart.trendband.service.auth.OkxRequestSigner;
import org.nowstart.trendband.venue.okx.OkxErrorDecoder;
import org.springframework.context.annotation.Bean;

public class OkxFeignConfig {

    @Bean
    public OkxRequestSigner okxRequestSigner(TradingProperties tradingProperties) {
        return new OkxRequestSigner(tradingProperties.secretKey());
    }

    @Bean
    public RequestInterceptor okxAuthRequestInterceptor(
            OkxRequestSigner okxRequestSigner,
            TradingProperties tradingProperties,
            Clock clock
    ) {
        return new OkxAuthRequestInterceptor(okxRequestSigner, tradingProperties, clock);
    }

    @Bean
    public ErrorDecoder okxErrorDecoder() {
        return new OkxErrorDecoder();
    }
}
