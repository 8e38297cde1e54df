package prism.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import prism.coordinator.api.Controller;
import prism.coordinator.api.Requests;
import prism.coordinator.api.v1.dto.HostRequest;
import prism.coordinator.api.v1.dto.HostResponse;
import prism.coordinator.model.Host;
import prism.coordinator.service.HostService;

import java.io.IOException;

/**
 * POST /api/v1/hosts - Register a worker host, returning its key.
 * GET /api/v1/hosts - List hosts (keys omitted).
 */
public class HostController implements Controller {

    private static final String HOSTS_PATH = "/api/v1/hosts";

    private final HostService hostService;

    public HostController(HostService hostService) {
        this.hostService = hostService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return HOSTS_PATH.equals(path) && (method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws IOException {
        if (req.method().equals(HttpMethod.GET)) {
            return ControllerResponse.json(Requests.json(
                    hostService.list().stream().map(HostResponse::withoutKey).toList()));
        }
        HostRequest body = Requests.body(req, HostRequest.class);
        Host host = hostService.register(body.hostName());
        return ControllerResponse.json(HttpResponseStatus.CREATED, Requests.json(HostResponse.withKey(host)));
    }
}
