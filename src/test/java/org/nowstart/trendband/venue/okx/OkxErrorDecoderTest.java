package org.nowstart.trendband.venue.okx;

import static org.assertj.core.api.Assertions.assertThat;

import feign.Request;
import feign.Response;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.trendband.data.exception.VenueException;
import org.nowstart.trendband.data.type.VenueErrorType;

class OkxErrorDecoderTest {

    private final OkxErrorDecoder decoder = new OkxErrorDecoder();

    @Test
    void decode_rateLimitIsTransient() {
        VenueException exception = decode(429, "{\"code\":\"50011\",\"msg\":\"Too Many Requests\"}");

        assertThat(exception.getType()).isEqualTo(VenueErrorType.TRANSIENT);
        assertThat(exception.getCode()).isEqualTo("50011");
    }

    @Test
    void decode_serverErrorIsTransient() {
        assertThat(decode(503, "").getType()).isEqualTo(VenueErrorType.TRANSIENT);
    }

    @Test
    void decode_authFailureIsFatal() {
        assertThat(decode(401, "{\"code\":\"50113\",\"msg\":\"Invalid Sign\"}").getType()).isEqualTo(VenueErrorType.FATAL);
    }

    @Test
    void decode_clientErrorUsesOkxCode() {
        assertThat(decode(400, "{\"code\":\"51008\",\"msg\":\"Insufficient balance\"}").getType())
                .isEqualTo(VenueErrorType.INSUFFICIENT_MARGIN);
        assertThat(decode(400, "not json").getType()).isEqualTo(VenueErrorType.REJECTED);
    }

    @Test
    void classify_mapsKnownCodes() {
        assertThat(OkxErrorCodes.classify("50013")).isEqualTo(VenueErrorType.TRANSIENT);
        assertThat(OkxErrorCodes.classify("51020")).isEqualTo(VenueErrorType.BELOW_MINIMUM);
        assertThat(OkxErrorCodes.classify("51000")).isEqualTo(VenueErrorType.REJECTED);
        assertThat(OkxErrorCodes.classify(null)).isEqualTo(VenueErrorType.REJECTED);
    }

    private VenueException decode(int status, String body) {
        Request request = Request.create(
                Request.HttpMethod.POST,
                "https://www.okx.com/api/v5/trade/order",
                Map.of(),
                null,
                StandardCharsets.UTF_8,
                null
        );
        Response response = Response.builder()
                .status(status)
                .reason("status " + status)
                .request(request)
                .headers(Map.of())
                .body(body, StandardCharsets.UTF_8)
                .build();
        return (VenueException) decoder.decode("OkxFeignClient#placeOrder", response);
    }
}
