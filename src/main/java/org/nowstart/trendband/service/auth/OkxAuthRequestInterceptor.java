package org.nowstart.trendband.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import lombok.RequiredArgsConstructor;
import org.nowstart.trendband.data.property.TradingProperties;

@RequiredArgsConstructor
public class OkxAuthRequestInterceptor implements RequestInterceptor {

    static final String HEADER_KEY = "OK-ACCESS-KEY";
    static final String HEADER_SIGN = "OK-ACCESS-SIGN";
    static final String HEADER_TIMESTAMP = "OK-ACCESS-TIMESTAMP";
    static final String HEADER_PASSPHRASE = "OK-ACCESS-PASSPHRASE";
    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final OkxRequestSigner okxRequestSigner;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    @Override
    public void apply(RequestTemplate template) {
        template.header("Accept", "application/json");
        if (!tradingProperties.hasCredentials()) {
            return;
        }

        String timestamp = TIMESTAMP_FORMAT.format(Instant.now(clock));
        byte[] body = template.body();
        String payload = body == null ? "" : new String(body, StandardCharsets.UTF_8);
        String signature = okxRequestSigner.sign(timestamp, template.method(), template.url(), payload);

        template.header(HEADER_KEY, tradingProperties.apiKey());
        template.header(HEADER_SIGN, signature);
        template.header(HEADER_TIMESTAMP, timestamp);
        template.header(HEADER_PASSPHRASE, tradingProperties.passphrase());
    }
}
