package prism.coordinator.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;
import prism.coordinator.server.RouterHandler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Request decoding helpers shared by controllers.
 */
public final class Requests {

    private Requests() {
    }

    /**
     * Decode a JSON body.
     *
     * @throws IllegalArgumentException if the body is empty
     */
    public static <T> T body(FullHttpRequest req, Class<T> type) throws IOException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        return RouterHandler.mapper().readValue(body, type);
    }

    public static byte[] rawBody(FullHttpRequest req) {
        byte[] bytes = new byte[req.content().readableBytes()];
        req.content().getBytes(req.content().readerIndex(), bytes);
        return bytes;
    }

    public static Optional<String> query(FullHttpRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    public static int queryInt(FullHttpRequest req, String name, int defaultValue) {
        Optional<String> value = query(req, name);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.get());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
    }

    public static String json(Object value) throws JsonProcessingException {
        return RouterHandler.mapper().writeValueAsString(value);
    }
}
