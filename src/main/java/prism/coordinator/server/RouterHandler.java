package prism.coordinator.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.AttributeKey;
import prism.coordinator.api.Controller;
import prism.coordinator.api.Controller.ControllerResponse;
import prism.coordinator.config.CoordinatorConfig;
import prism.coordinator.model.Host;
import prism.coordinator.service.HostService;
import prism.coordinator.service.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only handles versioned API endpoints:
 * - /api/v1/* (public API)
 * - /internal/v1/* (worker host API, bearer host key when host auth is on)
 *
 * All other endpoints return 404. Exceptions map to status codes:
 * IllegalArgumentException and malformed JSON to 400, NotFoundException to
 * 404, anything else to 500.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    /** Host authenticated for the request being handled on this channel */
    public static final AttributeKey<String> AUTHENTICATED_HOST = AttributeKey.valueOf("prism.host");

    private final List<Controller> controllers = new ArrayList<>();
    private final CoordinatorConfig config;
    private final HostService hostService;

    public RouterHandler(CoordinatorConfig config, HostService hostService) {
        this.config = config;
        this.hostService = hostService;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        String path = new QueryStringDecoder(uri).path();

        try {
            ctx.channel().attr(AUTHENTICATED_HOST).set(null);
            if (!checkAuth(ctx, req, path)) {
                log.warn("Auth failed for {} {}", method, path);
                writeSafe(ctx, UNAUTHORIZED, "application/json", "{\"error\":\"unauthorized\"}");
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    if (!response.isStreaming()) {
                        writeSafe(ctx, response.status(), response.contentType(), response.body());
                    }
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeSafe(ctx, NOT_FOUND, "application/json", "{\"error\":\"not found\"}");

        } catch (NotFoundException e) {
            log.debug("Not found: {} {} - {}", method, path, e.getMessage());
            writeError(ctx, NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {} {} - {}", method, path, e.getMessage());
            writeError(ctx, BAD_REQUEST, e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON: {} {} - {}", method, path, e.getOriginalMessage());
            writeError(ctx, BAD_REQUEST, "malformed request body: " + e.getOriginalMessage());
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            writeError(ctx, INTERNAL_SERVER_ERROR, e.toString());
        }
    }

    /**
     * Internal endpoints require a registered host key when host auth is enabled.
     */
    private boolean checkAuth(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (!config.hostAuthEnabled() || !path.startsWith("/internal/")) {
            return true;
        }

        String header = req.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return false;
        }
        Optional<Host> host = hostService.authenticate(header.substring(7).trim());
        host.ifPresent(h -> ctx.channel().attr(AUTHENTICATED_HOST).set(h.name()));
        return host.isPresent();
    }

    private void writeError(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
        writeSafe(ctx, status, "application/json",
                "{\"error\":\"" + ControllerResponse.escapeJson(message) + "\"}");
    }

    /**
     * Safe write that catches any exceptions during response writing.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            if (body == null) {
                body = "";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (RuntimeException e) {
            log.error("Failed to write response, closing channel", e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    /**
     * The host a worker request acts for: the authenticated host when host
     * auth is on, otherwise the host the request declares.
     */
    public static String hostOf(ChannelHandlerContext ctx, String declared) {
        String authenticated = ctx.channel().attr(AUTHENTICATED_HOST).get();
        return authenticated != null ? authenticated : declared;
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
