package prism.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import prism.coordinator.api.Controller;
import prism.coordinator.api.Requests;
import prism.coordinator.api.v1.dto.TraceDto;
import prism.coordinator.model.Trace;
import prism.coordinator.service.NotFoundException;
import prism.coordinator.service.TraceService;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GET /api/v1/traces/{traceId} - Trace metadata
 * GET /api/v1/traces?device_id= - Traces of one device
 */
public class TraceController implements Controller {

    private static final Pattern TRACES_PATTERN = Pattern.compile("^/api/v1/traces$");
    private static final Pattern TRACE_PATTERN = Pattern.compile("^/api/v1/traces/([^/]+)$");

    private final TraceService traceService;

    public TraceController(TraceService traceService) {
        this.traceService = traceService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && (TRACES_PATTERN.matcher(path).matches() || TRACE_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws IOException {
        Matcher m = TRACE_PATTERN.matcher(path);
        if (m.matches()) {
            String traceId = m.group(1);
            Trace trace = traceService.get(traceId).orElseThrow(() -> NotFoundException.of("trace", traceId));
            return ControllerResponse.json(Requests.json(TraceDto.from(trace)));
        }
        String deviceId = Requests.query(req, "device_id")
                .orElseThrow(() -> new IllegalArgumentException("device_id is required"));
        return ControllerResponse.json(Requests.json(
                traceService.listByDevice(deviceId).stream().map(TraceDto::from).toList()));
    }
}
