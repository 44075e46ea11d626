package org.nowstart.trendband.venue.okx;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Response;
import feign.Util;
import feign.codec.ErrorDecoder;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.data.exception.VenueException;
import org.nowstart.trendband.data.type.VenueErrorType;

@Slf4j
public class OkxErrorDecoder implements ErrorDecoder {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Override
    public Exception decode(String methodKey, Response response) {
        int status = response.status();
        String body = readBody(response);
        String code = readCode(body);
        String message = "OKX " + methodKey + " failed status=" + status + " code=" + code + " body=" + body;

        if (status == 429 || status >= 500) {
            return new VenueException(VenueErrorType.TRANSIENT, code, message);
        }
        if (status == 401 || status == 403) {
            return new VenueException(VenueErrorType.FATAL, code, message);
        }
        return new VenueException(OkxErrorCodes.classify(code), code, message);
    }

    private String readBody(Response response) {
        if (response.body() == null) {
            return "";
        }
        try (Reader reader = response.body().asReader(StandardCharsets.UTF_8)) {
            return Util.toString(reader);
        } catch (IOException e) {
            log.debug("event=okx_error_body_unreadable message={}", e.getMessage());
            return "";
        }
    }

    private String readCode(String body) {
        if (body.isBlank()) {
            return "";
        }
        try {
            JsonNode node = OBJECT_MAPPER.readTree(body);
            return node.path("code").asText("");
        } catch (IOException e) {
            return "";
        }
    }
}
