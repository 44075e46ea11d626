package org.nowstart.trendband.service.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.Test;

class OkxRequestSignerTest {

    private final OkxRequestSigner signer = new OkxRequestSigner("secret");

    @Test
    void sign_hashesTimestampMethodPathAndBody() throws Exception {
        String signature = signer.sign("2024-05-01T00:00:00.000Z", "post", "/api/v5/trade/order", "{\"sz\":\"1\"}");

        assertThat(signature).isEqualTo(hmac("2024-05-01T00:00:00.000ZPOST/api/v5/trade/order{\"sz\":\"1\"}"));
    }

    @Test
    void sign_treatsMissingBodyAsEmpty() {
        assertThat(signer.sign("ts", "GET", "/api/v5/account/balance?ccy=USDT", null))
                .isEqualTo(signer.sign("ts", "GET", "/api/v5/account/balance?ccy=USDT", ""));
    }

    private String hmac(String prehash) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec("secret".getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return Base64.getEncoder().encodeToString(mac.doFinal(prehash.getBytes(StandardCharsets.UTF_8)));
    }
}
